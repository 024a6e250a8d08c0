package com.fintech.paymentengine.dto;

import com.fintech.paymentengine.entity.CallbackStatus;
import com.fintech.paymentengine.entity.TransactionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Acknowledgement returned to the payment system for an accepted callback.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CallbackResponse {

    private Long callbackId;
    private CallbackStatus status;
    private Long transactionId;
    private TransactionStatus transactionStatus;
    private String message;
}
