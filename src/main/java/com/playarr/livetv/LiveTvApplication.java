package com.playarr.livetv;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class LiveTvApplication {

	private static final Logger logger = LoggerFactory.getLogger(LiveTvApplication.class);

	public static void main(String[] args) {
		SpringApplication.run(LiveTvApplication.class, args);
	}

	@EventListener(WebServerInitializedEvent.class)
	public void onWebServerReady(WebServerInitializedEvent event) {
		logger.info("Live TV service listening on port {}", event.getWebServer().getPort());
	}

}
