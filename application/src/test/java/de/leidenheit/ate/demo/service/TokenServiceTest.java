package de.leidenheit.ate.demo.service;

import de.leidenheit.ate.demo.config.DemoProperties;
import de.leidenheit.ate.demo.service.exception.AuthorizationException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenServiceTest {

    private final TokenService tokenService = new TokenService(new DemoProperties());

    @Test
    void shouldSignDeterministically() {
        // when
        var sign = tokenService.sign("sn", "ios", "2.8.6");

        // then
        assertThat(sign).matches("[0-9a-f]{40}");
        assertThat(tokenService.sign("sn", "ios", "2.8.6")).isEqualTo(sign);
        assertThat(tokenService.sign("sn", "android", "2.8.6")).isNotEqualTo(sign);
    }

    @Test
    void shouldVerifyIssuedTokenPerDevice() {
        // given
        var token = tokenService.issueToken("sn", "ios", "2.8.6", tokenService.sign("sn", "ios", "2.8.6"));

        // when & then
        assertThat(token).hasSize(16);
        assertThatCode(() -> tokenService.verify("sn", token)).doesNotThrowAnyException();
        assertThatThrownBy(() -> tokenService.verify("other", token)).isInstanceOf(AuthorizationException.class);
        assertThatThrownBy(() -> tokenService.verify("sn", null)).isInstanceOf(AuthorizationException.class);
    }

    @Test
    void shouldRejectForgedSign() {
        // when & then
        assertThatThrownBy(() -> tokenService.issueToken("sn", "ios", "2.8.6", "forged"))
                .isInstanceOf(AuthorizationException.class)
                .hasMessage("Authorization failed!");
    }
}
