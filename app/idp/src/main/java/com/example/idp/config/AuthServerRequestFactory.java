/*
 * Where: IdP configuration
 * What: HTTP request factory for calls to the authorization server
 * Why: connect/read timeouts and certificate trust are set once for token and key requests
 */
package com.example.idp.config;

import java.io.IOException;
import java.net.HttpURLConnection;
import java.security.GeneralSecurityException;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import javax.net.ssl.HostnameVerifier;
import javax.net.ssl.HttpsURLConnection;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;
import javax.net.ssl.X509TrustManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ssl.SslBundles;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.lang.Nullable;

public class AuthServerRequestFactory extends SimpleClientHttpRequestFactory {

  private static final Logger logger = LoggerFactory.getLogger(AuthServerRequestFactory.class);

  @Nullable private final SSLSocketFactory socketFactory;
  @Nullable private final HostnameVerifier hostnameVerifier;

  AuthServerRequestFactory(
      IdpHttpProperties properties,
      @Nullable SSLSocketFactory socketFactory,
      @Nullable HostnameVerifier hostnameVerifier) {
    this.socketFactory = socketFactory;
    this.hostnameVerifier = hostnameVerifier;
    setConnectTimeout(properties.connectTimeout());
    setReadTimeout(properties.readTimeout());
  }

  /**
   * Builds a factory that trusts the JVM default trust store, the named SSL bundle, or (only when
   * {@code idp.http.insecure-skip-verify} is set) any certificate.
   */
  public static AuthServerRequestFactory create(IdpHttpProperties properties, SslBundles sslBundles) {
    if (properties.sslBundle() != null) {
      final SSLContext context = sslBundles.getBundle(properties.sslBundle()).createSslContext();
      logger.info("authorization server trust uses ssl bundle={}", properties.sslBundle());
      return new AuthServerRequestFactory(properties, context.getSocketFactory(), null);
    }
    if (properties.insecureSkipVerify()) {
      logger.warn(
          "authorization server certificate verification is disabled (idp.http.insecure-skip-verify)");
      return new AuthServerRequestFactory(
          properties, trustAllContext().getSocketFactory(), (hostname, session) -> true);
    }
    return new AuthServerRequestFactory(properties, null, null);
  }

  @Override
  protected void prepareConnection(HttpURLConnection connection, String httpMethod)
      throws IOException {
    super.prepareConnection(connection, httpMethod);
    if (connection instanceof HttpsURLConnection https) {
      if (socketFactory != null) {
        https.setSSLSocketFactory(socketFactory);
      }
      if (hostnameVerifier != null) {
        https.setHostnameVerifier(hostnameVerifier);
      }
    }
  }

  private static SSLContext trustAllContext() {
    try {
      final SSLContext context = SSLContext.getInstance("TLS");
      context.init(null, new TrustManager[] {new TrustAllManager()}, new SecureRandom());
      return context;
    } catch (GeneralSecurityException ex) {
      throw new IllegalStateException("failed to initialize TLS context", ex);
    }
  }

  private static final class TrustAllManager implements X509TrustManager {

    @Override
    public void checkClientTrusted(X509Certificate[] chain, String authType) {
      // accept
    }

    @Override
    public void checkServerTrusted(X509Certificate[] chain, String authType) {
      // accept
    }

    @Override
    public X509Certificate[] getAcceptedIssuers() {
      return new X509Certificate[0];
    }
  }
}
