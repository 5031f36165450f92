package com.venueops.order.service;

import com.venueops.common.exception.BusinessException;
import com.venueops.common.exception.ErrorCode;
import com.venueops.order.entity.Order;
import com.venueops.order.entity.OrderStatus;
import com.venueops.order.entity.PaymentStatus;

import java.time.Instant;

/**
 * A validated move on both status axes, computed from one read of the order.
 * All transition rules live in {@link #plan}.
 */
record StatusChange(OrderStatus fromOrder, PaymentStatus fromPayment,
                    OrderStatus toOrder, PaymentStatus toPayment) {

    static StatusChange plan(Order current, OrderStatus targetOrder, PaymentStatus targetPayment) {
        OrderStatus fromOrder = current.getOrderStatus();
        PaymentStatus fromPayment = current.getPaymentStatus();
        boolean orderChanges = targetOrder != fromOrder;

        PaymentStatus toPayment = targetPayment != null ? targetPayment : fromPayment;
        if (targetOrder == OrderStatus.REFUNDED && targetPayment == null && fromPayment == PaymentStatus.PAID) {
            toPayment = PaymentStatus.REFUNDED;
        }
        boolean paymentChanges = toPayment != fromPayment;

        if (!orderChanges && !paymentChanges) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Order is already " + fromOrder + "/" + fromPayment);
        }
        if (orderChanges && !fromOrder.canTransitionTo(targetOrder)) {
            throw new BusinessException(ErrorCode.INVALID_ORDER_STATUS,
                    "Cannot move order from " + fromOrder + " to " + targetOrder);
        }
        if (paymentChanges) {
            if (!fromPayment.canTransitionTo(toPayment)) {
                throw new BusinessException(ErrorCode.INVALID_PAYMENT_STATUS,
                        "Cannot move payment from " + fromPayment + " to " + toPayment);
            }
            // A closed order's payment can only be refunded.
            if (fromOrder.isTerminal() && toPayment != PaymentStatus.REFUNDED) {
                throw new BusinessException(ErrorCode.INVALID_PAYMENT_STATUS,
                        "Payment of a " + fromOrder + " order can only be refunded");
            }
        }
        if (targetOrder == OrderStatus.COMPLETED && orderChanges && fromPayment != PaymentStatus.PAID) {
            throw new BusinessException(ErrorCode.PAYMENT_NOT_CONFIRMED,
                    "Order cannot be completed while payment is " + fromPayment);
        }
        return new StatusChange(fromOrder, fromPayment, targetOrder, toPayment);
    }

    /** Moving from an open status into a terminal one; the table can be given back. */
    boolean closesOrder() {
        return !fromOrder.isTerminal() && toOrder.isTerminal();
    }

    Instant servedAt(Order current, Instant now) {
        if (toOrder == OrderStatus.SERVED && current.getServedAt() == null) {
            return now;
        }
        return current.getServedAt();
    }

    Instant completedAt(Order current, Instant now) {
        if (toOrder == OrderStatus.COMPLETED && fromOrder != OrderStatus.COMPLETED) {
            return now;
        }
        return current.getCompletedAt();
    }
}
