package com.gamedrops.service.http;

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

public final class HttpClientFactory {
    public static final String TRUSTSTORE_PATH = "TRUSTSTORE_PATH";
    public static final String TRUSTSTORE_PASSWORD = "TRUSTSTORE_PASSWORD";

    private HttpClientFactory() {
    }

    public static HttpClient create(Duration connectTimeout, Map<String, String> environment) {
        HttpClient.Builder builder = HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .followRedirects(HttpClient.Redirect.NEVER)
                .version(HttpClient.Version.HTTP_1_1);
        TruststoreSettings truststore = TruststoreSettings.from(environment);
        if (truststore != null) {
            builder.sslContext(truststore.sslContext());
        }
        return builder.build();
    }

    record TruststoreSettings(Path path, char[] password) {
        static TruststoreSettings from(Map<String, String> environment) {
            String truststorePath = environment.get(TRUSTSTORE_PATH);
            if (truststorePath == null || truststorePath.isBlank()) {
                return null;
            }
            String truststorePassword = environment.get(TRUSTSTORE_PASSWORD);
            if (truststorePassword == null) {
                throw new IllegalStateException(TRUSTSTORE_PASSWORD + " must be set when " + TRUSTSTORE_PATH + " is configured");
            }
            Path path = Path.of(truststorePath);
            if (!Files.exists(path)) {
                throw new IllegalStateException("Truststore file does not exist: " + path);
            }
            return new TruststoreSettings(path, truststorePassword.toCharArray());
        }

        String type() {
            String lower = path.getFileName().toString().toLowerCase(Locale.ROOT);
            if (lower.endsWith(".p12") || lower.endsWith(".pfx") || lower.endsWith(".pkcs12")) {
                return "PKCS12";
            }
            return "JKS";
        }

        SSLContext sslContext() {
            try (InputStream in = Files.newInputStream(path)) {
                KeyStore trustStore = KeyStore.getInstance(type());
                trustStore.load(in, password);

                TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
                tmf.init(trustStore);

                SSLContext sslContext = SSLContext.getInstance("TLS");
                sslContext.init(null, tmf.getTrustManagers(), new SecureRandom());
                return sslContext;
            } catch (Exception e) {
                throw new IllegalStateException("Failed to build SSL context from truststore " + path, e);
            }
        }
    }
}
