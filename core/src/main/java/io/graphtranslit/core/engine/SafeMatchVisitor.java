package io.graphtranslit.core.engine;

import io.graphtranslit.core.spi.MatchVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Wraps a caller-supplied {@link MatchVisitor} so its failures are logged instead of propagated. */
final class SafeMatchVisitor implements MatchVisitor {

    private static final Logger LOG = LoggerFactory.getLogger(SafeMatchVisitor.class);

    private final MatchVisitor delegate;

    private SafeMatchVisitor(MatchVisitor delegate) {
        this.delegate = delegate;
    }

    static MatchVisitor wrap(MatchVisitor visitor) {
        if (visitor == null || visitor == MatchVisitor.NONE || visitor instanceof SafeMatchVisitor) {
            return visitor == null ? MatchVisitor.NONE : visitor;
        }
        return new SafeMatchVisitor(visitor);
    }

    @Override
    public void onNodeVisited(int nodeId) {
        try {
            delegate.onNodeVisited(nodeId);
        } catch (RuntimeException e) {
            LOG.warn("MatchVisitor.onNodeVisited failed", e);
        }
    }

    @Override
    public void onEdgeVisited(int headId, int tailId) {
        try {
            delegate.onEdgeVisited(headId, tailId);
        } catch (RuntimeException e) {
            LOG.warn("MatchVisitor.onEdgeVisited failed", e);
        }
    }

    @Override
    public void onOnMatchRuleApplied(int onMatchRuleIndex) {
        try {
            delegate.onOnMatchRuleApplied(onMatchRuleIndex);
        } catch (RuntimeException e) {
            LOG.warn("MatchVisitor.onOnMatchRuleApplied failed", e);
        }
    }
}
