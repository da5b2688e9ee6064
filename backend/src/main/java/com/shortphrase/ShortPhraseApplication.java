package com.shortphrase;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * ShortPhrase - rewrites long sentences into sentences under a word limit.
 */
@SpringBootApplication
public class ShortPhraseApplication {

	public static void main(String[] args) {
		SpringApplication.run(ShortPhraseApplication.class, args);
	}

}
