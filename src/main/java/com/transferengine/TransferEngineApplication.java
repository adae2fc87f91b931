package com.transferengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Transfer Engine.
 *
 * Transfer Engine executes deposits, withdrawals and same- or cross-currency
 * transfers concurrently while keeping every account balance exact, and keeps
 * an append-only audit trail of each committed or failed transaction.
 */
@SpringBootApplication
public class TransferEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TransferEngineApplication.class, args);
    }
}
