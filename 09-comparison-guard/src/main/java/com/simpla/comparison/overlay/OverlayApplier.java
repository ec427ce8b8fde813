package com.simpla.comparison.overlay;

import com.simpla.dictamen.model.Operation;
import com.simpla.dictamen.model.Target;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Applies an {@link OperationOverlay} to parsed operations, in place. Per operation the order is:
 * law replacement, then manual match, then null-target override. A manual match or an override
 * forces the target, so later automatic resolution leaves it alone.
 */
public class OverlayApplier {

    private static final Logger LOG = LoggerFactory.getLogger(OverlayApplier.class);

    /**
     * @return how many operations were touched
     */
    public int apply(List<Operation> operations, OperationOverlay overlay) {
        if (overlay == null || overlay.isEmpty()) {
            return 0;
        }
        Map<String, OperationOverlay.ManualMatch> matches = new LinkedHashMap<>();
        for (OperationOverlay.ManualMatch match : overlay.getManualMatches()) {
            if (match.getDictamenArticle() != null) {
                matches.put(match.getDictamenArticle(), match);
            }
        }
        Set<String> nullTargets = new HashSet<>(overlay.getNullTargetOverrides());

        int touched = 0;
        for (Operation operation : operations) {
            String id = operation.getDictamenArticle();
            boolean changed = false;

            String replacement = overlay.getLawReplacements().get(id);
            if (replacement != null) {
                operation.setLawNumber(replacement);
                changed = true;
            }

            OperationOverlay.ManualMatch match = matches.get(id);
            if (match != null) {
                if (match.getTargetLaw() != null) {
                    operation.setLawNumber(match.getTargetLaw());
                }
                if (match.getTargetArticle() != null) {
                    operation.setListedArticles(Collections.emptyList());
                    operation.forceTarget(Target.article(match.getTargetArticle()));
                }
                changed = true;
            } else if (nullTargets.contains(id)) {
                operation.setListedArticles(Collections.emptyList());
                operation.forceTarget(Target.wholeLaw());
                operation.setRequiresReview(false);
                changed = true;
            }

            if (changed) {
                touched++;
                LOG.debug("Overlay applied to dictamen article {}: {}", id, operation);
            }
        }
        LOG.info("Overlay touched {} of {} operations", touched, operations.size());
        return touched;
    }
}
