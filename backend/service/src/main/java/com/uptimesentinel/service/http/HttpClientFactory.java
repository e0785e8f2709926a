package com.uptimesentinel.service.http;

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
 * Builds the client shared by HTTP probes and webhook destinations. Redirects are followed, so a
 * monitor pointing at a redirecting URL reports the final answer. {@code TRUSTSTORE_PATH} and
 * {@code TRUSTSTORE_PASSWORD} replace the JDK trust store, for monitoring hosts signed by a
 * private CA.
 */
public final class HttpClientFactory {
    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout) {
        return create(connectTimeout, System.getenv());
    }

    static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NORMAL);
        trustStoreContext(environment).ifPresent(builder::sslContext);
        return builder.build();
    }

    static Optional<SSLContext> trustStoreContext(Map<String, String> environment) {
        String location = environment.get("TRUSTSTORE_PATH");
        if (location == null || location.isBlank()) {
            return Optional.empty();
        }
        String password = environment.get("TRUSTSTORE_PASSWORD");
        if (password == null) {
            throw new IllegalStateException("TRUSTSTORE_PASSWORD must be set when TRUSTSTORE_PATH is configured");
        }
        Path path = Path.of(location);
        if (!Files.exists(path)) {
            throw new IllegalStateException("Truststore file does not exist: " + path);
        }

        try (InputStream in = Files.newInputStream(path)) {
            KeyStore trustStore = KeyStore.getInstance(storeType(path));
            trustStore.load(in, password.toCharArray());

            TrustManagerFactory factory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            factory.init(trustStore);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(null, factory.getTrustManagers(), new SecureRandom());
            return Optional.of(context);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
        }
    }

    private static String storeType(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".p12") || name.endsWith(".pfx") || name.endsWith(".pkcs12")) {
            return "PKCS12";
        }
        return "JKS";
    }
}
