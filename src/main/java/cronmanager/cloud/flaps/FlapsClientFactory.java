package cronmanager.cloud.flaps;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import cronmanager.cloud.MachineClient;
import cronmanager.cloud.MachineClientFactory;
import cronmanager.cloud.auth.AuthService;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Builds {@link FlapsMachineClient}s that share one HTTP client and credential.
 */
public class FlapsClientFactory implements MachineClientFactory {

    private final HttpClient http;
    private final ObjectMapper mapper;
    private final AuthService auth;
    private final String baseUrl;
    private final Duration requestTimeout;

    public FlapsClientFactory(AuthService auth, String baseUrl, Duration requestTimeout) {
        this.http = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
        this.mapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .findAndRegisterModules();
        this.auth = auth;
        this.baseUrl = baseUrl;
        this.requestTimeout = requestTimeout;
    }

    @Override
    public MachineClient forApp(String appName) {
        return new FlapsMachineClient(http, mapper, auth, baseUrl, appName, requestTimeout);
    }
}
