package de.leidenheit.ate.demo.service;

import com.google.common.base.Strings;
import com.google.common.hash.Hashing;
import de.leidenheit.ate.demo.config.DemoProperties;
import de.leidenheit.ate.demo.service.exception.AuthorizationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Issues one token per device. A token request must be signed with the SHA-1 of the device data
 * followed by the shared secret.
 */
@Slf4j
@Service
public class TokenService {

    private static final String ALPHANUMERIC = "ABCDEFGHIJKLMNOPQRSTUVWXYZabcdefghijklmnopqrstuvwxyz0123456789";

    private final DemoProperties properties;
    private final SecureRandom random = new SecureRandom();
    private final Map<String, String> tokensByDevice = new ConcurrentHashMap<>();

    public TokenService(final DemoProperties properties) {
        this.properties = properties;
    }

    public String issueToken(final String deviceSn, final String osPlatform, final String appVersion, final String sign) {
        var expectedSign = sign(deviceSn, osPlatform, appVersion);
        if (!expectedSign.equals(sign)) {
            log.warn("Rejected token request of device '{}': invalid sign", deviceSn);
            throw new AuthorizationException("Authorization failed!");
        }

        var token = generateToken();
        tokensByDevice.put(deviceSn, token);
        log.info("Issued token for device '{}'", deviceSn);
        return token;
    }

    public void verify(final String deviceSn, final String token) {
        if (Strings.isNullOrEmpty(deviceSn)
                || Strings.isNullOrEmpty(token)
                || !Objects.equals(tokensByDevice.get(deviceSn), token)) {
            throw new AuthorizationException("Authorization failed!");
        }
    }

    @SuppressWarnings("deprecation")
    public String sign(final String deviceSn, final String osPlatform, final String appVersion) {
        var content = Strings.nullToEmpty(deviceSn)
                + Strings.nullToEmpty(osPlatform)
                + Strings.nullToEmpty(appVersion)
                + properties.getSecretKey();
        return Hashing.sha1().hashString(content, StandardCharsets.UTF_8).toString();
    }

    private String generateToken() {
        var builder = new StringBuilder(properties.getTokenLength());
        for (int i = 0; i < properties.getTokenLength(); i++) {
            builder.append(ALPHANUMERIC.charAt(random.nextInt(ALPHANUMERIC.length())));
        }
        return builder.toString();
    }
}
