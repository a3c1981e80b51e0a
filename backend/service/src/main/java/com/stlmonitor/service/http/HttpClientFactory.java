package com.stlmonitor.service.http;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Builds the single outbound {@link HttpClient} shared by every collector. Feed hosts and relays redirect freely,
 * so redirects are followed (never from https down to http). A custom truststore can be supplied through
 * {@code TRUSTSTORE_PATH} and {@code TRUSTSTORE_PASSWORD}.
 */
public final class HttpClientFactory {
    public static final String TRUSTSTORE_PATH = "TRUSTSTORE_PATH";
    public static final String TRUSTSTORE_PASSWORD = "TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        truststoreContext(environment).ifPresent(builder::sslContext);
        return builder.build();
    }

    private static Optional<SSLContext> truststoreContext(Map<String, String> environment) {
        String location = environment.get(TRUSTSTORE_PATH);
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get(TRUSTSTORE_PASSWORD);
        if (password == null) {
            throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
        }
        Path path = Path.of(location);
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(storeType(path));
            trustStore.load(in, password.toCharArray());
            TrustManagerFactory trustManagers = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            trustManagers.init(trustStore);
            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, trustManagers.getTrustManagers(), new SecureRandom());
            return Optional.of(context);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    static String storeType(Path path) {
        String fileName = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (fileName.endsWith(".p12") || fileName.endsWith(".pfx") || fileName.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }
}
