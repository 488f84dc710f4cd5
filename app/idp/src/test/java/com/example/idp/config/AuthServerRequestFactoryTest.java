package com.example.idp.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verifyNoInteractions;

import java.net.URL;
import java.time.Duration;
import javax.net.ssl.HttpsURLConnection;
import org.junit.jupiter.api.Test;
import org.springframework.boot.ssl.SslBundles;

class AuthServerRequestFactoryTest {

  private final SslBundles sslBundles = mock(SslBundles.class);

  @Test
  void defaultTrustKeepsJvmVerification() throws Exception {
    final AuthServerRequestFactory factory =
        AuthServerRequestFactory.create(
            new IdpHttpProperties(Duration.ofSeconds(2), Duration.ofSeconds(3), null, false),
            sslBundles);
    final HttpsURLConnection connection =
        (HttpsURLConnection) new URL("https://hydra.test/oauth2/token").openConnection();

    factory.prepareConnection(connection, "POST");

    assertThat(connection.getConnectTimeout()).isEqualTo(2000);
    assertThat(connection.getReadTimeout()).isEqualTo(3000);
    assertThat(connection.getSSLSocketFactory())
        .isSameAs(HttpsURLConnection.getDefaultSSLSocketFactory());
    assertThat(connection.getHostnameVerifier())
        .isSameAs(HttpsURLConnection.getDefaultHostnameVerifier());
    verifyNoInteractions(sslBundles);
  }

  @Test
  void insecureSkipVerifyAcceptsAnyHostname() throws Exception {
    final AuthServerRequestFactory factory =
        AuthServerRequestFactory.create(new IdpHttpProperties(null, null, null, true), sslBundles);
    final HttpsURLConnection connection =
        (HttpsURLConnection) new URL("https://hydra.test/keys").openConnection();

    factory.prepareConnection(connection, "GET");

    assertThat(connection.getSSLSocketFactory())
        .isNotSameAs(HttpsURLConnection.getDefaultSSLSocketFactory());
    assertThat(connection.getHostnameVerifier().verify("other.test", null)).isTrue();
  }
}
