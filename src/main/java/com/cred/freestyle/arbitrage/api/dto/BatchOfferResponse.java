package com.cred.freestyle.arbitrage.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-record result of a batch ingestion. One failing record does not affect the others.
 *
 * @author Arbitrage Team
 */
@Data
@NoArgsConstructor
public class BatchOfferResponse {

    private int accepted;
    private int rejected;
    private List<Item> results = new ArrayList<>();

    public void addAccepted(int index, OfferResponse offer) {
        results.add(new Item(index, offer.getOutcome(), offer.getOfferId(), null));
        accepted++;
    }

    public void addRejected(int index, String status, String error) {
        results.add(new Item(index, status, null, error));
        rejected++;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Item {
        private int index;
        private String status;
        private String offerId;
        private String error;
    }
}
