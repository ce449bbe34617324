package com.rendezvous.gateway;

import com.rendezvous.directory.AppRegistry;
import com.rendezvous.observability.RelayMetrics;
import com.rendezvous.protocol.FrameCodec;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class RelayBeans {

    @Bean
    public RelayMetrics relayMetrics() {
        return new RelayMetrics();
    }

    @Bean
    public AppRegistry appRegistry(RelayMetrics metrics) {
        return new AppRegistry(metrics);
    }

    @Bean
    public FrameCodec frameCodec() {
        return new FrameCodec();
    }
}
