/*
 * Where: IdP service layer
 * What: user lookup backed by an htpasswd file of bcrypt hashes
 * Why: the consent endpoint authenticates users with HTTP Basic against a flat file
 */
package com.example.idp.service;

import com.example.idp.config.BasicAuthProperties;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.security.core.userdetails.User;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.stereotype.Service;

@Service
public class HtpasswdUserDetailsService implements UserDetailsService {

  private static final Logger logger = LoggerFactory.getLogger(HtpasswdUserDetailsService.class);

  private static final Pattern BCRYPT_HASH =
      Pattern.compile("^\\$2[aby]?\\$\\d{2}\\$[./0-9A-Za-z]{53}$");

  private final Map<String, String> passwordHashes;

  @Autowired
  public HtpasswdUserDetailsService(BasicAuthProperties properties, ResourceLoader resourceLoader) {
    this(read(resourceLoader.getResource(properties.htpasswd())));
  }

  HtpasswdUserDetailsService(Map<String, String> passwordHashes) {
    this.passwordHashes = Map.copyOf(passwordHashes);
  }

  @Override
  public UserDetails loadUserByUsername(String username) {
    final String hash = passwordHashes.get(username);
    if (hash == null) {
      throw new UsernameNotFoundException("unknown user");
    }
    return User.withUsername(username).password(hash).roles("USER").build();
  }

  int size() {
    return passwordHashes.size();
  }

  /** Parses {@code user:hash} lines; blank lines and {@code #} comments are ignored. */
  static Map<String, String> parse(List<String> lines) {
    final Map<String, String> hashes = new HashMap<>();
    int lineNumber = 0;
    for (String raw : lines) {
      lineNumber++;
      final String line = raw.trim();
      if (line.isEmpty() || line.startsWith("#")) {
        continue;
      }
      final int separator = line.indexOf(':');
      if (separator <= 0) {
        logger.warn("htpasswd line {} skipped: missing user separator", lineNumber);
        continue;
      }
      final String user = line.substring(0, separator);
      final String hash = line.substring(separator + 1);
      if (!BCRYPT_HASH.matcher(hash).matches()) {
        logger.warn("htpasswd entry skipped: only bcrypt hashes are supported user={}", user);
        continue;
      }
      hashes.put(user, hash);
    }
    return hashes;
  }

  private static Map<String, String> read(Resource resource) {
    try (BufferedReader reader =
        new BufferedReader(new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
      final Map<String, String> hashes = parse(reader.lines().toList());
      logger.info("htpasswd loaded location={} users={}", resource.getDescription(), hashes.size());
      return hashes;
    } catch (IOException ex) {
      throw new IllegalStateException("failed to read htpasswd " + resource.getDescription(), ex);
    }
  }
}
