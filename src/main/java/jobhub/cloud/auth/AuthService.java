package jobhub.cloud.auth;

import jobhub.backend.error.BackendConfigException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import yandex.cloud.api.compute.v1.InstanceServiceGrpc;
import yandex.cloud.sdk.ServiceFactory;
import yandex.cloud.sdk.auth.Auth;

import java.time.Duration;
import java.util.List;

/**
 * Yandex Cloud SDK entry point of one backend: builds the service factory from an OAuth
 * token taken from the configured environment variable and creates the gRPC stubs.
 */
public class AuthService {

    private static final Logger log = LoggerFactory.getLogger(AuthService.class);

    private final ServiceFactory factory;
    private final InstanceServiceGrpc.InstanceServiceBlockingStub instanceService;

    public AuthService(String oauthTokenEnv, Duration requestTimeout) {
        String token = System.getenv(oauthTokenEnv);
        if (token == null || token.isBlank()) {
            throw new BackendConfigException("Environment variable " + oauthTokenEnv + " with the OAuth token is not set",
                    BackendConfigException.MISSING_FIELD, List.of("CLOUD.oauth_token_env"));
        }
        this.factory = ServiceFactory.builder()
                .credentialProvider(Auth.oauthTokenBuilder().fromEnv(oauthTokenEnv))
                .requestTimeout(requestTimeout)
                .build();

        this.instanceService = factory.create(
                InstanceServiceGrpc.InstanceServiceBlockingStub.class,
                InstanceServiceGrpc::newBlockingStub
        );
        log.info("Yandex Cloud services ready (token from {})", oauthTokenEnv);
    }

    public ServiceFactory getFactory() { return factory; }
    public InstanceServiceGrpc.InstanceServiceBlockingStub getInstanceService() { return instanceService; }
}
