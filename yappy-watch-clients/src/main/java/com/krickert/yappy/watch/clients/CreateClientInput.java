package com.krickert.yappy.watch.clients;

import lombok.Builder;

/**
 * Connection settings for one backend client.
 *
 * @param address           host:port or full URL of the backend
 * @param namespace         enterprise namespace, empty for none
 * @param token             access token, empty for anonymous access
 * @param unwrapToken       treat {@code token} as a response-wrapping token and exchange it first
 * @param basicAuthEnabled  send HTTP basic credentials
 * @param basicAuthUsername basic-auth user
 * @param basicAuthPassword basic-auth password
 * @param ssl               use https when {@code address} carries no scheme
 */
@Builder(toBuilder = true)
public record CreateClientInput(
        String address,
        String namespace,
        String token,
        boolean unwrapToken,
        boolean basicAuthEnabled,
        String basicAuthUsername,
        String basicAuthPassword,
        boolean ssl
) {

    public CreateClientInput {
        address = address == null ? "" : address.trim();
        namespace = namespace == null ? "" : namespace;
        token = token == null ? "" : token;
        basicAuthUsername = basicAuthUsername == null ? "" : basicAuthUsername;
        basicAuthPassword = basicAuthPassword == null ? "" : basicAuthPassword;
    }

    /**
     * The address as a base URL without a trailing slash.
     */
    public String baseUrl() {
        String url = address;
        if (!url.contains("://")) {
            url = (ssl ? "https://" : "http://") + url;
        }
        while (url.endsWith("/")) {
            url = url.substring(0, url.length() - 1);
        }
        return url;
    }

    @Override
    public String toString() {
        return "CreateClientInput[address=" + address + ", namespace=" + namespace
                + ", unwrapToken=" + unwrapToken + ", basicAuthEnabled=" + basicAuthEnabled + ", ssl=" + ssl + "]";
    }
}
