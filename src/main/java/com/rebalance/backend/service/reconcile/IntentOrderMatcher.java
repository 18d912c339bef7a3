package com.rebalance.backend.service.reconcile;

import com.rebalance.backend.model.TradeOrder;
import com.rebalance.backend.model.params.IntentOrderMismatch;
import com.rebalance.backend.service.intent.OrderIntentFileService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Checks that the intent file handed to the execution process lists exactly the symbols that were persisted.
 */
@Component
@RequiredArgsConstructor
public class IntentOrderMatcher {

    private final OrderIntentFileService orderIntentFileService;

    /**
     * @return the mismatch, or empty when both sides agree
     */
    public Optional<IntentOrderMismatch> compare(Path intentPath, Collection<TradeOrder> orders) {
        Set<String> intentSymbols = orderIntentFileService.readIntentSymbols(intentPath).orElse(Set.of());
        Set<String> orderSymbols = new TreeSet<>();
        for (TradeOrder order : orders) {
            orderSymbols.add(order.getSymbol());
        }
        Set<String> missing = new TreeSet<>(orderSymbols);
        missing.removeAll(intentSymbols);
        Set<String> extra = new TreeSet<>(intentSymbols);
        extra.removeAll(orderSymbols);
        if (missing.isEmpty() && extra.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new IntentOrderMismatch(new ArrayList<>(missing), new ArrayList<>(extra)));
    }
}
