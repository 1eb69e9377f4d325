package com.loanmatch.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;

/**
 * Approved (applicant, product, batch) pair. The natural key is unique; _id is derived from it so that
 * re-submission of the same decision upserts onto the existing document.
 */
@Document(collection = "matches")
@CompoundIndex(name = "applicant_product_batch", def = "{'applicantId': 1, 'productId': 1, 'batchId': 1}", unique = true)
@CompoundIndex(name = "batch_score", def = "{'batchId': 1, 'score': -1}")
@CompoundIndex(name = "batch_notification", def = "{'batchId': 1, 'notificationSent': 1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class Match {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String applicantId;
    private String productId;
    private String batchId;
    /** 0..100. */
    private int score;
    private MatchType matchType;
    /** Explanation; carries the judgment rationale for ESCALATED matches. */
    private String rationale;
    /** Owned by the notifier. */
    private boolean notificationSent;
    private Instant notificationSentAt;
    private Instant createdAt;

    public static String naturalKey(String applicantId, String productId, String batchId) {
        return applicantId + ":" + productId + ":" + batchId;
    }
}
