package com.newswebsite.service;

import com.newswebsite.entity.Newsletter;

/**
 * Result of a subscribe call: a new row, or a previously unsubscribed one turned back on.
 */
public record SubscriptionOutcome(Newsletter subscriber, boolean reactivated) {
}
