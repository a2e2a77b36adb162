package restopm.billing.service;

import org.springframework.stereotype.Component;

/**
 * Check-digit validation of Ecuadorian taxpayer identifications.
 * <ul>
 *   <li>10 digits: cédula, module 10.</li>
 *   <li>13 digits, third digit 0-5: natural person RUC, cédula plus establishment.</li>
 *   <li>13 digits, third digit 6: public entity RUC, module 11 over 8 digits.</li>
 *   <li>13 digits, third digit 9: private company RUC, module 11 over 9 digits.</li>
 * </ul>
 * Anything else is treated as a passport and accepted as typed.
 */
@Component
public class IdentificationValidator {

    private static final int[] PUBLIC_WEIGHTS = {3, 2, 7, 6, 5, 4, 3, 2};
    private static final int[] PRIVATE_WEIGHTS = {4, 3, 2, 7, 6, 5, 4, 3, 2};

    public boolean isValid(String identification) {
        if (identification == null) {
            return false;
        }
        String value = identification.trim();
        if (!isNumeric(value) || (value.length() != 10 && value.length() != 13)) {
            return !value.isEmpty();
        }
        if (!hasValidProvince(value)) {
            return false;
        }
        int thirdDigit = value.charAt(2) - '0';
        if (value.length() == 10) {
            return thirdDigit < 6 && validCedula(value);
        }
        if (thirdDigit < 6) {
            return validCedula(value.substring(0, 10)) && !value.endsWith("000");
        }
        if (thirdDigit == 6) {
            return module11(value, PUBLIC_WEIGHTS) && !value.endsWith("0000");
        }
        if (thirdDigit == 9) {
            return module11(value, PRIVATE_WEIGHTS) && !value.endsWith("000");
        }
        return false;
    }

    public boolean isPassport(String identification) {
        if (identification == null || identification.isBlank()) {
            return false;
        }
        String value = identification.trim();
        return !isNumeric(value) || (value.length() != 10 && value.length() != 13);
    }

    private static boolean hasValidProvince(String value) {
        int province = Integer.parseInt(value.substring(0, 2));
        return (province >= 1 && province <= 24) || province == 30;
    }

    private static boolean validCedula(String cedula) {
        int sum = 0;
        for (int i = 0; i < 9; i++) {
            int digit = cedula.charAt(i) - '0';
            if (i % 2 == 0) {
                digit *= 2;
                if (digit > 9) {
                    digit -= 9;
                }
            }
            sum += digit;
        }
        int expected = sum % 10 == 0 ? 0 : 10 - (sum % 10);
        return expected == cedula.charAt(9) - '0';
    }

    private static boolean module11(String value, int[] weights) {
        int sum = 0;
        for (int i = 0; i < weights.length; i++) {
            sum += (value.charAt(i) - '0') * weights[i];
        }
        int remainder = sum % 11;
        int expected = remainder == 0 ? 0 : 11 - remainder;
        if (expected == 10) {
            return false;
        }
        return expected == value.charAt(weights.length) - '0';
    }

    private static boolean isNumeric(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
