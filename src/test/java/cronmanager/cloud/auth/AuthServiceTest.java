package cronmanager.cloud.auth;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AuthServiceTest {

    @Test
    void plainTokenUsesBearerScheme() {
        assertEquals("Bearer abc123", new AuthService(" abc123 ").authorizationHeader());
    }

    @Test
    void macaroonTokenIsSentAsIs() {
        assertEquals("FlyV1 fm2_xyz", new AuthService("FlyV1 fm2_xyz").authorizationHeader());
    }

    @Test
    void blankTokenRejected() {
        assertThrows(IllegalStateException.class, () -> new AuthService("  "));
        assertThrows(IllegalStateException.class, () -> new AuthService(null));
    }

    @Test
    void missingVariableNamedInError() {
        IllegalStateException e = assertThrows(IllegalStateException.class,
                () -> AuthService.fromEnv("CRON_MANAGER_TEST_TOKEN_THAT_IS_NOT_SET"));
        assertEquals("CRON_MANAGER_TEST_TOKEN_THAT_IS_NOT_SET environment variable is not set", e.getMessage());
    }

    @Test
    void toStringHidesToken() {
        assertFalse(new AuthService("secret").toString().contains("secret"));
    }
}
