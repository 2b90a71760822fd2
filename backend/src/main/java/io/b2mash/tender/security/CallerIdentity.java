package io.b2mash.tender.security;

import java.util.Optional;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.authentication.AuthenticationCredentialsNotFoundException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;

/**
 * Resolves the identity of the current caller from the security context. For bearer-token requests
 * this is the JWT {@code sub} claim; it is the identity used for voters, company representatives
 * and the tender admin alike.
 */
public final class CallerIdentity {

  private CallerIdentity() {}

  /** Returns the caller identity. Throws if the request is not authenticated. */
  public static String requireCallerId() {
    return currentCallerId()
        .orElseThrow(
            () -> new AuthenticationCredentialsNotFoundException("No authenticated caller"));
  }

  /** Returns the caller identity, or empty outside an authenticated request. */
  public static Optional<String> currentCallerId() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null
        || authentication instanceof AnonymousAuthenticationToken
        || !authentication.isAuthenticated()) {
      return Optional.empty();
    }
    return Optional.ofNullable(authentication.getName());
  }
}
