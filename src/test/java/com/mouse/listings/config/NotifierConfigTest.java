package com.mouse.listings.config;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NotifierConfigTest {

    @Test
    void resolveBaseUrl_derivesDataCenterFromKey() {
        NotifierConfig config = new NotifierConfig();
        config.setApiKey("0123456789abcdef-us21");

        assertThat(config.resolveBaseUrl()).isEqualTo("https://us21.api.mailchimp.com/3.0");
    }

    @Test
    void resolveBaseUrl_overrideWins() {
        NotifierConfig config = new NotifierConfig();
        config.setApiKey("key-us5");
        config.setBaseUrl("http://localhost:8089/3.0/");

        assertThat(config.resolveBaseUrl()).isEqualTo("http://localhost:8089/3.0");
    }

    @Test
    void resolveBaseUrl_keyWithoutSuffix_fails() {
        NotifierConfig config = new NotifierConfig();
        config.setApiKey("nosuffix");

        assertThatThrownBy(config::resolveBaseUrl).isInstanceOf(IllegalStateException.class);
    }
}
