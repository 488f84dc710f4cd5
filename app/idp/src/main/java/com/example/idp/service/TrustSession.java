package com.example.idp.service;

import java.time.Instant;
import org.springframework.web.client.RestClient;

/**
 * An authenticated transport to the authorization server. Every request sent through {@code
 * transport} carries a bearer token obtained with the client credentials grant.
 */
public record TrustSession(RestClient transport, Instant establishedAt) {}
