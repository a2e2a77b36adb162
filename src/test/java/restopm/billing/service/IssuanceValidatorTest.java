package restopm.billing.service;

import org.junit.jupiter.api.Test;
import restopm.billing.exception.IssuanceValidationException;
import restopm.billing.model.ClientData;
import restopm.billing.model.IssuanceWarning;
import restopm.billing.model.Order;
import restopm.billing.model.OrderItem;
import restopm.billing.model.OrderStatus;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class IssuanceValidatorTest {

    private final IssuanceValidator validator =
            new IssuanceValidator(new IdentificationValidator(), "9999999999999", new BigDecimal("50.00"));

    @Test
    void finalConsumerAboveLimitIsWarned() {
        List<IssuanceWarning> warnings = validator.warnings(order("60.00"), finalConsumer());

        assertThat(warnings).extracting(IssuanceWarning::getCode)
                .containsExactly(IssuanceWarning.Code.FINAL_CONSUMER_LIMIT);
    }

    @Test
    void finalConsumerAtLimitIsNotWarned() {
        assertThat(validator.warnings(order("50.00"), finalConsumer())).isEmpty();
    }

    @Test
    void identifiedClientWithoutEmailIsWarned() {
        ClientData client = ClientData.builder().identification("1710034065").name("Ana Pérez").build();

        assertThat(validator.warnings(order("20.00"), client)).extracting(IssuanceWarning::getCode)
                .containsExactly(IssuanceWarning.Code.NO_EMAIL_DELIVERY);
    }

    @Test
    void placeholderAndMalformedEmailsAreNotDeliverable() {
        assertThat(IssuanceValidator.isDeliverableEmail("ana@correo.ec")).isTrue();
        assertThat(IssuanceValidator.isDeliverableEmail("noemail@correo.ec")).isFalse();
        assertThat(IssuanceValidator.isDeliverableEmail("consumidor@final.com")).isFalse();
        assertThat(IssuanceValidator.isDeliverableEmail("a@b.ec,c@d.ec")).isFalse();
        assertThat(IssuanceValidator.isDeliverableEmail("ana @correo.ec")).isFalse();
        assertThat(IssuanceValidator.isDeliverableEmail("ana@correo")).isFalse();
    }

    @Test
    void badCheckDigitIsWarnedNotBlocked() {
        ClientData client = ClientData.builder()
                .identification("1710034064").name("Ana Pérez").email("ana@correo.ec").build();

        assertThat(validator.warnings(order("20.00"), client)).extracting(IssuanceWarning::getCode)
                .containsExactly(IssuanceWarning.Code.IDENTIFICATION_CHECK_DIGIT);
        validator.validate(order("20.00"), client);
    }

    @Test
    void missingIdentificationIsRejected() {
        ClientData client = ClientData.builder().name("Ana").build();

        assertThatThrownBy(() -> validator.validate(order("10.00"), client))
                .isInstanceOf(IssuanceValidationException.class)
                .hasMessageContaining("identificación");
    }

    @Test
    void missingNameIsRejected() {
        ClientData client = ClientData.builder().identification("1710034065").build();

        assertThatThrownBy(() -> validator.validate(order("10.00"), client))
                .isInstanceOf(IssuanceValidationException.class)
                .hasMessageContaining("nombre");
    }

    @Test
    void orderWithoutItemsIsRejected() {
        Order empty = Order.builder().id("o-1").status(OrderStatus.COMPLETED).build();

        assertThatThrownBy(() -> validator.validate(empty, finalConsumer()))
                .isInstanceOf(IssuanceValidationException.class);
    }

    @Test
    void onlyCompletedUnbilledOrdersCanBeInvoiced() {
        Order ready = order("10.00");
        ready.setStatus(OrderStatus.READY);
        Order billed = order("10.00");
        billed.setBilled(true);

        assertThatThrownBy(() -> validator.validate(ready, finalConsumer()))
                .isInstanceOf(IssuanceValidationException.class)
                .hasMessageContaining("completadas");
        assertThatThrownBy(() -> validator.validate(billed, finalConsumer()))
                .isInstanceOf(IssuanceValidationException.class)
                .hasMessageContaining("ya fue facturada");
    }

    private static ClientData finalConsumer() {
        return ClientData.builder().identification("9999999999999").name("CONSUMIDOR FINAL").build();
    }

    private static Order order(String total) {
        return Order.builder()
                .id("o-1")
                .status(OrderStatus.COMPLETED)
                .items(List.of(OrderItem.builder()
                        .name("Menú del día").quantity(1).price(new BigDecimal(total)).prepared(true).build()))
                .build();
    }
}
