package com.codeheadsystems.pairing.dropwizard;

import com.codeheadsystems.pairing.dropwizard.auth.PairingAuthenticator;
import com.codeheadsystems.pairing.dropwizard.health.PairingStoreHealthCheck;
import com.codeheadsystems.pairing.server.auth.AuthenticatedPrincipal;
import com.codeheadsystems.pairing.server.auth.TokenService;
import com.codeheadsystems.pairing.server.auth.UnifiedAuthGate;
import com.codeheadsystems.pairing.server.manager.AdminLoginManager;
import com.codeheadsystems.pairing.server.manager.ClientManager;
import com.codeheadsystems.pairing.server.manager.ClientTokenManager;
import com.codeheadsystems.pairing.server.manager.ExpirySweeper;
import com.codeheadsystems.pairing.server.manager.PairingSessionManager;
import com.codeheadsystems.pairing.server.notify.NotificationRegistry;
import com.codeheadsystems.pairing.server.resource.AuthResource;
import com.codeheadsystems.pairing.server.resource.ClientResource;
import com.codeheadsystems.pairing.server.resource.ClientTokenResource;
import com.codeheadsystems.pairing.server.resource.EventStreamResource;
import com.codeheadsystems.pairing.server.resource.PairingExceptionMapper;
import com.codeheadsystems.pairing.server.resource.PairingResource;
import com.codeheadsystems.pairing.server.store.ClientStore;
import com.codeheadsystems.pairing.server.store.InMemoryClientStore;
import com.codeheadsystems.pairing.server.store.InMemoryPairingSessionStore;
import com.codeheadsystems.pairing.server.store.PairingSessionStore;
import io.dropwizard.auth.AuthDynamicFeature;
import io.dropwizard.auth.AuthValueFactoryProvider;
import io.dropwizard.auth.oauth.OAuthCredentialAuthFilter;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.util.HexFormat;
import org.glassfish.jersey.media.sse.SseFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that wires the pairing backend into an existing Dropwizard application.
 * <p>
 * Registers the pairing, client, token, login and event-stream resources, the error mapper,
 * the bearer-credential auth filter, the {@code pairing-store} health check and the managed
 * expiry sweep. Requires a {@link PairingConfiguration} block in the application's YAML config.
 * <p>
 * Embed in your application with in-memory stores (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new PairingBundle<>());
 * }</pre>
 * <p>
 * Or supply persistent stores:
 * <pre>{@code
 *   bootstrap.addBundle(new PairingBundle<>(mySessionStore, myClientStore));
 * }</pre>
 */
@Singleton
public class PairingBundle<C extends PairingConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(PairingBundle.class);

  private final PairingSessionStore sessionStore;
  private final ClientStore clientStore;
  private final Clock clock;

  private NotificationRegistry notificationRegistry;

  /**
   * Creates a bundle backed by in-memory stores.
   * <p>
   * For dev/test only. Sessions, clients and token records are lost on restart, after which
   * every paired device must pair again.
   */
  public PairingBundle() {
    this(new InMemoryPairingSessionStore(), new InMemoryClientStore(), Clock.systemUTC());
    log.warn("""
        #################################################################
        # WARNING: Using in-memory pairing and client stores.           #
        # Paired devices will NOT survive restarts.                     #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied stores.
   *
   * @param sessionStore the pairing session store
   * @param clientStore  the client and token store
   */
  @Inject
  public PairingBundle(PairingSessionStore sessionStore, ClientStore clientStore) {
    this(sessionStore, clientStore, Clock.systemUTC());
  }

  PairingBundle(PairingSessionStore sessionStore, ClientStore clientStore, Clock clock) {
    this.sessionStore = sessionStore;
    this.clientStore = clientStore;
    this.clock = clock;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    TokenService tokenService = buildTokenService(configuration);
    notificationRegistry = new NotificationRegistry(clientStore, clock,
        Duration.ofMillis(configuration.getDisconnectGraceMillis()));

    PairingSessionManager pairingSessionManager = new PairingSessionManager(sessionStore, clientStore,
        tokenService, notificationRegistry, clock, new SecureRandom(),
        Duration.ofSeconds(configuration.getPinTtlSeconds()),
        Duration.ofSeconds(configuration.getVerifiedSessionTtlSeconds()),
        configuration.getMaxPinAttempts());
    ClientManager clientManager = new ClientManager(clientStore, notificationRegistry, clock);
    ClientTokenManager clientTokenManager =
        new ClientTokenManager(clientStore, tokenService, notificationRegistry, clock);
    AdminLoginManager adminLoginManager = new AdminLoginManager(
        configuration.getAdminUsername(), configuration.getAdminPassword(), tokenService);

    environment.jersey().register(new PairingExceptionMapper());
    environment.jersey().register(SseFeature.class);
    environment.jersey().register(new AuthResource(adminLoginManager));
    environment.jersey().register(new PairingResource(pairingSessionManager));
    environment.jersey().register(new ClientResource(clientManager));
    environment.jersey().register(new ClientTokenResource(clientTokenManager));
    environment.jersey().register(new EventStreamResource(notificationRegistry));

    // Bearer auth filter for routes marked @PermitAll or taking an @Auth parameter
    PairingAuthenticator authenticator =
        new PairingAuthenticator(new UnifiedAuthGate(tokenService, clientStore, clock));
    environment.jersey().register(new AuthDynamicFeature(
        new OAuthCredentialAuthFilter.Builder<AuthenticatedPrincipal>()
            .setAuthenticator(authenticator)
            .setPrefix("Bearer")
            .buildAuthFilter()));
    environment.jersey().register(new AuthValueFactoryProvider.Binder<>(AuthenticatedPrincipal.class));

    environment.healthChecks().register("pairing-store",
        new PairingStoreHealthCheck(sessionStore, clientStore, notificationRegistry));

    ExpirySweeper expirySweeper = new ExpirySweeper(pairingSessionManager, tokenService,
        Duration.ofSeconds(configuration.getSweepIntervalSeconds()),
        Duration.ofSeconds(configuration.getSessionRetentionSeconds()));
    environment.lifecycle().manage(new PairingLifecycle(expirySweeper, notificationRegistry,
        Duration.ofSeconds(configuration.getKeepAliveSeconds())));
  }

  /**
   * The registry built by {@link #run}, for applications that push their own events (for
   * example area changes through {@link NotificationRegistry#notifyByArea}).
   *
   * @return the notification registry, or null before the bundle has run
   */
  public NotificationRegistry getNotificationRegistry() {
    return notificationRegistry;
  }

  private TokenService buildTokenService(C configuration) {
    String secretHex = configuration.getJwtSecretHex();
    byte[] secret;
    if (secretHex == null || secretHex.isEmpty()) {
      log.warn("No JWT secret configured, generating one randomly. "
          + "Every credential will be invalidated on restart. Do not use in production.");
      secret = new byte[32];
      new SecureRandom().nextBytes(secret);
    } else {
      secret = HexFormat.of().parseHex(secretHex);
      if (secret.length < 32) {
        throw new IllegalStateException("jwtSecretHex must encode at least 32 bytes");
      }
    }
    return new TokenService(secret, configuration.getJwtIssuer(), configuration.getJwtAudience(),
        Duration.ofDays(configuration.getClientTokenTtlDays()),
        Duration.ofSeconds(configuration.getAdminTokenTtlSeconds()),
        clientStore, clock);
  }
}
