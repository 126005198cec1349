package com.civic.realtime.service.config;

import com.civic.realtime.service.transport.InMemoryRealtimeTransport;
import com.civic.realtime.service.transport.RealtimeTransport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Default transport and clock.
 *
 * A hosted backend replaces the loopback transport by declaring its own
 * {@link RealtimeTransport} bean.
 */
@Slf4j
@Configuration
public class TransportConfig {

    @Bean
    @ConditionalOnMissingBean(RealtimeTransport.class)
    public InMemoryRealtimeTransport inMemoryRealtimeTransport() {
        log.info("No RealtimeTransport configured, using in-memory loopback transport");
        return new InMemoryRealtimeTransport();
    }

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
