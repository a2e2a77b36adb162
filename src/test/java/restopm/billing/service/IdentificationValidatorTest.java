package restopm.billing.service;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdentificationValidatorTest {

    private final IdentificationValidator validator = new IdentificationValidator();

    @Test
    void acceptsValidCedulaAndNaturalPersonRuc() {
        assertThat(validator.isValid("1710034065")).isTrue();
        assertThat(validator.isValid("1710034065001")).isTrue();
    }

    @Test
    void rejectsWrongCheckDigit() {
        assertThat(validator.isValid("1710034064")).isFalse();
        assertThat(validator.isValid("1710034064001")).isFalse();
    }

    @Test
    void rejectsUnknownProvince() {
        assertThat(validator.isValid("2510034065")).isFalse();
    }

    @Test
    void validatesPrivateCompanyRucWithModule11() {
        assertThat(validator.isValid("1790011674001")).isTrue();
        assertThat(validator.isValid("1790011675001")).isFalse();
    }

    @Test
    void rucMustNotEndInZeroEstablishment() {
        assertThat(validator.isValid("1710034065000")).isFalse();
    }

    @Test
    void passportsAreAccepted() {
        assertThat(validator.isValid("AB123456")).isTrue();
        assertThat(validator.isPassport("AB123456")).isTrue();
        assertThat(validator.isPassport("1710034065")).isFalse();
    }

    @Test
    void blankIsInvalid() {
        assertThat(validator.isValid(null)).isFalse();
        assertThat(validator.isValid("  ")).isFalse();
    }
}
