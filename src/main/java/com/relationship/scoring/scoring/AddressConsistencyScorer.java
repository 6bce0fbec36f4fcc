package com.relationship.scoring.scoring;

import com.relationship.scoring.core.model.AddressConsistencyResult;
import com.relationship.scoring.core.model.Record;
import com.relationship.scoring.scoring.FieldPrecedence.AddressSelection;

import java.util.List;
import java.util.Locale;

/**
 * Compares the customer's address with the shell's, as case-insensitive exact text.
 * Field precedence differs per side, see {@link FieldPrecedence}.
 */
public class AddressConsistencyScorer {

    static final String NO_SHELL = "No shell record data available";

    public AddressConsistencyResult score(Record customer, Record shell) {
        if (shell == null) {
            return AddressConsistencyResult.missingData(NO_SHELL);
        }

        AddressSelection customerAddress = FieldPrecedence.customerAddress(customer);
        AddressSelection shellAddress = FieldPrecedence.shellAddress(shell);
        if (!customerAddress.isPresent() || !shellAddress.isPresent()) {
            return AddressConsistencyResult.missingData(String.format(
                    "Missing address data: customer has %s, shell has %s",
                    describe(customerAddress), describe(shellAddress)));
        }

        boolean consistent = customerAddress.address().toLowerCase(Locale.ROOT)
                .equals(shellAddress.address().toLowerCase(Locale.ROOT));
        String comparison = String.format("Customer %s '%s' vs shell %s '%s'",
                customerAddress.source().label(), customerAddress.address(),
                shellAddress.source().label(), shellAddress.address());
        return new AddressConsistencyResult(consistent,
                List.of(comparison, consistent ? "Addresses match" : "Addresses differ"));
    }

    private static String describe(AddressSelection selection) {
        return selection.isPresent() ? selection.source().label() : "no address";
    }
}
