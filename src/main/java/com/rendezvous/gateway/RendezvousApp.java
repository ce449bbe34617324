package com.rendezvous.gateway;

import com.rendezvous.shared.config.ConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.rendezvous")
public class RendezvousApp {

    private static final Logger log = LoggerFactory.getLogger(RendezvousApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();
        if (config.welcome().motd() != null) {
            log.info("MOTD: {}", config.welcome().motd());
        }

        var app = new SpringApplication(RendezvousApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        app.addInitializers(ctx -> ctx.getBeanFactory().registerSingleton("relayConfig", config));
        app.run(args);
        log.info("Rendezvous relay listening on port {}", config.serverPort());
    }
}
