package com.acme.invoicemail.core.config;

import com.acme.invoicemail.core.InvoiceMailProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.net.http.HttpClient;
import java.time.Clock;

/**
 * Beans shared by every invoice mail service.
 */
@Configuration
public class CoreConfiguration {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * RestTemplate for Graph and the token endpoint. Backed by the JDK
     * HttpClient so PATCH is supported; both timeouts are bounded.
     */
    @Bean
    public RestTemplate graphRestTemplate(InvoiceMailProperties properties) {
        InvoiceMailProperties.Graph graph = properties.getGraph();
        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(graph.getConnectTimeout())
                .build();
        JdkClientHttpRequestFactory factory = new JdkClientHttpRequestFactory(httpClient);
        factory.setReadTimeout(graph.getReadTimeout());
        return new RestTemplate(factory);
    }
}
