package com.payerdesk.chatbot.service.orchestration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

@ConfigurationProperties(prefix = "chat.cost")
public class CostProperties {

    private List<Rate> rates = new ArrayList<>();

    public List<Rate> getRates() {
        return rates;
    }

    public void setRates(List<Rate> rates) {
        this.rates = rates;
    }

    /**
     * USD per 1K tokens for one provider and model.
     */
    public static class Rate {

        private String provider;
        private String model;
        private double inputPer1k;
        private double outputPer1k;

        public Rate() {
        }

        public Rate(String provider, String model, double inputPer1k, double outputPer1k) {
            this.provider = provider;
            this.model = model;
            this.inputPer1k = inputPer1k;
            this.outputPer1k = outputPer1k;
        }

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public double getInputPer1k() {
            return inputPer1k;
        }

        public void setInputPer1k(double inputPer1k) {
            this.inputPer1k = inputPer1k;
        }

        public double getOutputPer1k() {
            return outputPer1k;
        }

        public void setOutputPer1k(double outputPer1k) {
            this.outputPer1k = outputPer1k;
        }
    }
}
