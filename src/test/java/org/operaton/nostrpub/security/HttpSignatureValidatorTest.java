package org.operaton.nostrpub.security;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.operaton.nostrpub.TestFixtures;
import org.operaton.nostrpub.exception.SignatureInvalidException;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpSignatureValidatorTest {

    private static final String KEY_ID = "https://mastodon.example/users/alice#main-key";
    private static final String TARGET = "https://bridge.example/users/npub1abc/inbox";
    private static final String BODY = "{\"type\":\"Follow\"}";

    private static HttpSignatureValidator.PemKeyPair keyPair;

    private final HttpSignatureValidator validator = new HttpSignatureValidator(TestFixtures.properties(), TestFixtures.clock());

    @BeforeAll
    static void generateKeys() {
        keyPair = new HttpSignatureValidator(TestFixtures.properties(), TestFixtures.clock()).generateKeyPair();
    }

    // ==================== Parsing Tests ====================

    @Test
    void parse_withParametersInAnyOrder_shouldExtractAll() {
        HttpSignatureValidator.ParsedSignature parsed = validator.parse(
            "signature=\"abc=\",headers=\"(request-target) host date\",keyId=\"" + KEY_ID + "\",algorithm=\"hs2019\"");

        assertThat(parsed.keyId).isEqualTo(KEY_ID);
        assertThat(parsed.algorithm).isEqualTo("hs2019");
        assertThat(parsed.headers).isEqualTo("(request-target) host date");
        assertThat(parsed.signature).isEqualTo("abc=");
        assertThat(parsed.ownerUri()).isEqualTo("https://mastodon.example/users/alice");
    }

    @Test
    void parse_withoutHeadersParameter_shouldDefaultToDate() {
        HttpSignatureValidator.ParsedSignature parsed = validator.parse("keyId=\"" + KEY_ID + "\",signature=\"abc=\"");

        assertThat(parsed.headers).isEqualTo("date");
        assertThat(parsed.algorithm).isEqualTo("rsa-sha256");
    }

    @Test
    void parse_withMissingKeyId_shouldThrowException() {
        assertThatThrownBy(() -> validator.parse("signature=\"abc=\""))
            .isInstanceOf(SignatureInvalidException.class);
    }

    @Test
    void parse_withNullHeader_shouldThrowException() {
        assertThatThrownBy(() -> validator.parse(null))
            .isInstanceOf(SignatureInvalidException.class)
            .hasMessageContaining("Missing");
    }

    // ==================== Signature Tests ====================

    @Test
    void signRequest_thenVerify_shouldSucceed() {
        HttpSignatureValidator.SignatureHeaders signed =
            validator.signRequest("POST", TARGET, BODY, keyPair.privateKeyPem, KEY_ID);

        boolean valid = validator.verify(validator.parse(signed.signature), headersOf(signed), keyPair.publicKeyPem);

        assertThat(valid).isTrue();
        assertThat(signed.host).isEqualTo("bridge.example");
    }

    @Test
    void verify_withChangedRequestTarget_shouldFail() {
        HttpSignatureValidator.SignatureHeaders signed =
            validator.signRequest("POST", TARGET, BODY, keyPair.privateKeyPem, KEY_ID);
        Map<String, String> headers = headersOf(signed);
        headers.put("(request-target)", "post /inbox");

        assertThat(validator.verify(validator.parse(signed.signature), headers, keyPair.publicKeyPem)).isFalse();
    }

    @Test
    void verify_withOtherKey_shouldFail() {
        HttpSignatureValidator.SignatureHeaders signed =
            validator.signRequest("POST", TARGET, BODY, keyPair.privateKeyPem, KEY_ID);
        HttpSignatureValidator.PemKeyPair other = validator.generateKeyPair();

        assertThat(validator.verify(validator.parse(signed.signature), headersOf(signed), other.publicKeyPem)).isFalse();
    }

    @Test
    void verify_withMissingSignedHeader_shouldFail() {
        HttpSignatureValidator.SignatureHeaders signed =
            validator.signRequest("POST", TARGET, BODY, keyPair.privateKeyPem, KEY_ID);
        Map<String, String> headers = headersOf(signed);
        headers.remove("digest");

        assertThat(validator.verify(validator.parse(signed.signature), headers, keyPair.publicKeyPem)).isFalse();
    }

    // ==================== Digest Tests ====================

    @Test
    void digestMatches_withSignedBody_shouldSucceed() {
        HttpSignatureValidator.SignatureHeaders signed =
            validator.signRequest("POST", TARGET, BODY, keyPair.privateKeyPem, KEY_ID);

        assertThat(validator.digestMatches(signed.digest, BODY.getBytes(StandardCharsets.UTF_8))).isTrue();
    }

    @Test
    void digestMatches_withTamperedBody_shouldFail() {
        HttpSignatureValidator.SignatureHeaders signed =
            validator.signRequest("POST", TARGET, BODY, keyPair.privateKeyPem, KEY_ID);

        assertThat(validator.digestMatches(signed.digest, "{\"type\":\"Undo\"}".getBytes(StandardCharsets.UTF_8)))
            .isFalse();
    }

    @Test
    void digestMatches_withoutSha256_shouldFail() {
        assertThat(validator.digestMatches("SHA-512=abc", new byte[0])).isFalse();
        assertThat(validator.digestMatches(null, new byte[0])).isFalse();
    }

    // ==================== Date Tests ====================

    @Test
    void dateWithinSkew_withCurrentDate_shouldSucceed() {
        HttpSignatureValidator.SignatureHeaders signed =
            validator.signRequest("POST", TARGET, BODY, keyPair.privateKeyPem, KEY_ID);

        assertThat(validator.dateWithinSkew(signed.date)).isTrue();
    }

    @Test
    void dateWithinSkew_withDateTooOld_shouldFail() {
        Clock past = Clock.fixed(TestFixtures.NOW.minus(Duration.ofHours(13)), ZoneOffset.UTC);
        HttpSignatureValidator.SignatureHeaders signed = new HttpSignatureValidator(TestFixtures.properties(), past)
            .signRequest("POST", TARGET, BODY, keyPair.privateKeyPem, KEY_ID);

        assertThat(validator.dateWithinSkew(signed.date)).isFalse();
    }

    @Test
    void dateWithinSkew_withGarbage_shouldFail() {
        assertThat(validator.dateWithinSkew("yesterday")).isFalse();
        assertThat(validator.dateWithinSkew(null)).isFalse();
    }

    private static Map<String, String> headersOf(HttpSignatureValidator.SignatureHeaders signed) {
        Map<String, String> headers = new HashMap<>();
        headers.put("(request-target)", "post /users/npub1abc/inbox");
        headers.put("host", signed.host);
        headers.put("date", signed.date);
        headers.put("digest", signed.digest);
        return headers;
    }
}
