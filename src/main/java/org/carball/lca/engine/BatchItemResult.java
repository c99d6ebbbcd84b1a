package org.carball.lca.engine;

import org.carball.lca.model.result.LCAResult;

/**
 * Outcome of one product in a batch: either a result or the reason it failed.
 */
public record BatchItemResult(String productId, LCAResult result, String error) {

    public static BatchItemResult success(LCAResult result) {
        return new BatchItemResult(result.getProductId(), result, null);
    }

    public static BatchItemResult failure(String productId, String error) {
        return new BatchItemResult(productId, null, error);
    }

    public boolean isSuccess() {
        return result != null;
    }
}
