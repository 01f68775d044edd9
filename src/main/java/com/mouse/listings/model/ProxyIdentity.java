package com.mouse.listings.model;

public record ProxyIdentity(String host, int port, String username, String password) {

    public String server() {
        return "http://" + host + ":" + port;
    }

    public boolean hasCredentials() {
        return username != null && !username.isBlank();
    }

    @Override
    public String toString() {
        return host + ":" + port;
    }
}
