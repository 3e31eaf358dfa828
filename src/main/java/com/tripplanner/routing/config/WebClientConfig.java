package com.tripplanner.routing.config;

import io.netty.channel.ChannelOption;
import java.time.Duration;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import reactor.netty.http.client.HttpClient;

@Configuration
public class WebClientConfig {
    @Bean
    public WebClient webClient(@Autowired RoutingProperties config) {
        // per-call timeouts are tighter; this is the outer bound for any external call
        int responseTimeout = Math.max(config.getChain().getBudget(),
                Math.max(config.getOverpass().getTimeout(), config.getStadia().getTimeout()));
        int connectTimeout = Math.max(3000, config.getValhalla().getStatusTimeout());

        HttpClient httpClient = HttpClient.create()
                .responseTimeout(Duration.ofMillis(responseTimeout))
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, connectTimeout);

        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .codecs(c -> c.defaultCodecs().maxInMemorySize(16 * 1024 * 1024))
                .build();
    }
}
