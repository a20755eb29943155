package cronmanager.cloud.auth;

/**
 * Holds the Machines API credential and renders it as an Authorization header.
 *
 * Tokens minted by {@code fly tokens create} already carry their {@code FlyV1}
 * scheme and are sent as-is; anything else is treated as a bearer token.
 */
public class AuthService {

    public static final String DEFAULT_TOKEN_ENV = "FLY_API_TOKEN";

    private static final String MACAROON_SCHEME = "FlyV1 ";

    private final String token;

    public AuthService(String token) {
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("machines API token is empty");
        }
        this.token = token.trim();
    }

    /**
     * Read the token from the environment.
     *
     * @throws IllegalStateException if the variable is unset or blank
     */
    public static AuthService fromEnv(String variable) {
        String value = System.getenv(variable);
        if (value == null || value.isBlank()) {
            throw new IllegalStateException(variable + " environment variable is not set");
        }
        return new AuthService(value);
    }

    public String authorizationHeader() {
        if (token.startsWith(MACAROON_SCHEME)) {
            return token;
        }
        return "Bearer " + token;
    }

    @Override
    public String toString() {
        return "AuthService{token=***}";
    }
}
