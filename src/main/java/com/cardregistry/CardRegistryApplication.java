package com.cardregistry;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Card Registry.
 *
 * Card Registry keeps ownable, uniquely numbered cards, each carrying a bounded
 * use counter and a level fixed at mint time. Ownership bookkeeping, use accounting,
 * metadata resolution and role-gated administration are wired here as Spring beans.
 */
@SpringBootApplication
public class CardRegistryApplication {

    public static void main(String[] args) {
        SpringApplication.run(CardRegistryApplication.class, args);
    }
}
