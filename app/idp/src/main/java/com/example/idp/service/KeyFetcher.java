package com.example.idp.service;

import com.example.idp.model.KeyRole;
import java.security.Key;

/** Retrieves the current key for a role from the authorization server. */
public interface KeyFetcher {

  Key fetch(KeyRole role);
}
