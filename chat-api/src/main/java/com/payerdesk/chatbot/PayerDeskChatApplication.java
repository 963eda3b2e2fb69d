package com.payerdesk.chatbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class PayerDeskChatApplication {

    public static void main(String[] args) {
        SpringApplication.run(PayerDeskChatApplication.class, args);
    }
}
