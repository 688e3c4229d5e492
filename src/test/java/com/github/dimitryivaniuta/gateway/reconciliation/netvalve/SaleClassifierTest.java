package com.github.dimitryivaniuta.gateway.reconciliation.netvalve;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SaleClassifierTest {

    private final SaleClassifier classifier = new SaleClassifier();

    @Test
    void cleanSuccess_isApproved() {
        SaleVerdict v = classifier.classify(200, "GTW_1000", "SUCCESS", "Transaction approved", "BNK_2000");

        Assertions.assertTrue(v.approved());
        Assertions.assertNull(v.declineReason());
    }

    @Test
    void httpErrorStatus_isDeclined() {
        Assertions.assertFalse(classifier.classify(402, "GTW_1000", "SUCCESS", "Transaction approved", null).approved());
    }

    @Test
    void otherResponseCode_isDeclined() {
        Assertions.assertFalse(classifier.classify(200, "GTW_1001", "SUCCESS", "ok", null).approved());
    }

    @Test
    void declineCodeType_isDeclinedEvenWithSuccessCode() {
        Assertions.assertFalse(classifier.classify(200, "GTW_1000", "soft_decline", "ok", null).approved());
        Assertions.assertFalse(classifier.classify(200, "GTW_1000", "REJECTED", "ok", null).approved());
    }

    @Test
    void declineKeywordInMessage_isDeclined() {
        Assertions.assertFalse(classifier.classify(200, "GTW_1000", "SUCCESS", "Do Not Honor", null).approved());
        Assertions.assertFalse(classifier.classify(200, "GTW_1000", "SUCCESS", "Card EXPIRED", null).approved());
    }

    @Test
    void bankCodeOtherThanApproved_isDeclined() {
        Assertions.assertFalse(classifier.classify(200, "GTW_1000", "SUCCESS", "ok", "BNK_2051").approved());
    }

    @Test
    void knownBankDeclineCode_isDeclinedWithReason() {
        SaleVerdict v = classifier.classify(200, "GTW_1000", "SUCCESS", "ok", "51");

        Assertions.assertFalse(v.approved());
        Assertions.assertEquals("Insufficient funds", v.declineReason());
    }

    @Test
    void unknownBankCode_hasNoReason() {
        Assertions.assertNull(SaleClassifier.declineReasonFor("99"));
        Assertions.assertNull(SaleClassifier.declineReasonFor(null));
    }
}
