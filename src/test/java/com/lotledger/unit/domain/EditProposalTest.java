package com.lotledger.unit.domain;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lotledger.domain.enums.EditRule;
import com.lotledger.domain.enums.EditStatus;
import com.lotledger.domain.enums.TransactionType;
import com.lotledger.domain.model.EditProposal;
import com.lotledger.domain.model.EditViolation;
import com.lotledger.domain.model.LedgerTransaction;
import com.lotledger.domain.model.TransactionEdit;
import java.math.BigDecimal;
import java.time.LocalDate;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class EditProposalTest {

    private final LedgerTransaction original = LedgerTransaction.builder()
            .id(1L)
            .instrumentId("INFY")
            .transactionType(TransactionType.BUY)
            .transactionDate(LocalDate.of(2024, 1, 1))
            .quantity(new BigDecimal("10"))
            .unitPrice(new BigDecimal("100"))
            .notes("initial")
            .build();

    @Test
    @DisplayName("Proposed record applies only the non-null edit fields")
    void appliesNonNullFields() {
        TransactionEdit edit = TransactionEdit.builder().quantity(new BigDecimal("7")).build();

        EditProposal proposal = new EditProposal(1L, original, edit);

        assertThat(proposal.getStatus()).isEqualTo(EditStatus.PROPOSED);
        assertThat(proposal.getProposed().getQuantity()).isEqualByComparingTo("7");
        assertThat(proposal.getProposed().getUnitPrice()).isEqualByComparingTo("100");
        assertThat(proposal.getProposed().getNotes()).isEqualTo("initial");
        assertThat(proposal.getOriginal().getQuantity()).isEqualByComparingTo("10");
    }

    @Test
    @DisplayName("Accepted is terminal")
    void acceptedIsTerminal() {
        EditProposal proposal = new EditProposal(1L, original, TransactionEdit.builder().notes("x").build());

        proposal.accept();

        assertThat(proposal.isAccepted()).isTrue();
        assertThatThrownBy(proposal::accept).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(() -> proposal.reject(violation())).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Rejected is terminal and keeps the violation")
    void rejectedIsTerminal() {
        EditProposal proposal = new EditProposal(1L, original, TransactionEdit.builder().notes("x").build());

        proposal.reject(violation());

        assertThat(proposal.isRejected()).isTrue();
        assertThat(proposal.getViolation().getRule()).isEqualTo(EditRule.QUANTITY_BELOW_MATCHED);
        assertThatThrownBy(proposal::accept).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("An edit with no fields is empty")
    void emptyEdit() {
        assertThat(TransactionEdit.builder().build().isEmpty()).isTrue();
        assertThat(TransactionEdit.builder().notes("n").build().isEmpty()).isFalse();
    }

    private static EditViolation violation() {
        return EditViolation.builder()
                .rule(EditRule.QUANTITY_BELOW_MATCHED)
                .field("quantity")
                .message("too small")
                .quantityBound(new BigDecimal("6"))
                .build();
    }
}
