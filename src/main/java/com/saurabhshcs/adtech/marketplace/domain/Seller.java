package com.saurabhshcs.adtech.marketplace.domain;
import lombok.Getter;
import java.util.ArrayList;
import java.util.List;
/** Owns products by id; stock and price always come from the catalog. */
@Getter
public class Seller {
    private final long id;
    private final String name;
    private final List<Long> productIds = new ArrayList<>();
    public Seller(long id, String name) {
        this.id = id;
        this.name = name;
    }
    public synchronized void own(long productId) { productIds.add(productId); }
    public synchronized List<Long> getProductIds() { return List.copyOf(productIds); }
}
