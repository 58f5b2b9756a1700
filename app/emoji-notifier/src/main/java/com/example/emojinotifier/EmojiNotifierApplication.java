/*
 * Where: emoji-notifier entry point
 * What: Boots Spring and scans configuration properties
 * Why: Wires the aggregation worker, transports and directory in one context
 */
package com.example.emojinotifier;

import com.example.common.config.TimeConfig;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.context.annotation.Import;

@SpringBootApplication
@ConfigurationPropertiesScan
@Import(TimeConfig.class)
public class EmojiNotifierApplication {

	public static void main(String[] args) {
		SpringApplication.run(EmojiNotifierApplication.class, args);
	}
}
