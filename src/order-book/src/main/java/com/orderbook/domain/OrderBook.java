package com.orderbook.domain;

/**
 * In-memory order book for a single instrument.
 *
 * Bundles the {@link OrderLedger} (orders by identifier), the {@link PriceLadder}
 * (identifiers by side and price) and the arrival sequence counter. Owned by exactly
 * one command processor; not thread-safe.
 */
public class OrderBook {

    private final OrderLedger ledger;
    private final PriceLadder ladder;
    private long lastSequence;

    public OrderBook() {
        this.ledger = new OrderLedger();
        this.ladder = new PriceLadder();
        this.lastSequence = 0;
    }

    /**
     * Next arrival sequence number. Keeps increasing across {@link #clear()}.
     */
    public long nextSequence() {
        return ++lastSequence;
    }

    public long getLastSequence() {
        return lastSequence;
    }

    /**
     * Add an order with remaining quantity to the ledger and to the back of its price level.
     */
    public void rest(Order order) throws OrderRejectedException {
        ledger.insert(order);
        ladder.rest(order.getSide(), order.getLimitPrice(), order.getId());
    }

    /**
     * Remove a live order from the ledger and its price level.
     *
     * @throws OrderRejectedException UNKNOWN_ORDER if the identifier is not live
     */
    public Order cancel(OrderId orderId) throws OrderRejectedException {
        Order order = ledger.remove(orderId);
        ladder.remove(order.getSide(), order.getLimitPrice(), orderId);
        return order;
    }

    /** Drop every resting order and forget used identifiers. The sequence counter is kept. */
    public void clear() {
        ledger.clear();
        ladder.clear();
    }

    public PriceLevel getBestBid() {
        return ladder.best(Side.BUY);
    }

    public PriceLevel getBestAsk() {
        return ladder.best(Side.SELL);
    }

    /**
     * Sum of remaining quantity at the best level of the side, or 0 if the side is empty.
     */
    public long bestLevelQuantity(Side side) {
        PriceLevel level = ladder.best(side);
        return level == null ? 0 : levelQuantity(level);
    }

    /**
     * Sum of remaining quantity at the level, saturating at Long.MAX_VALUE.
     */
    public long levelQuantity(PriceLevel level) {
        long total = 0;
        for (OrderId id : level.getOrderIds()) {
            Order order = ledger.find(id);
            if (order == null) {
                throw new BookInvariantViolationException(
                        "Order " + id + " at price " + level.getPrice() + " missing from ledger");
            }
            total = Quantities.saturatedAdd(total, order.getRemainingQuantity());
        }
        return total;
    }

    /** True if the best bid is at or above the best ask. Never true once a command settles. */
    public boolean isCrossed() {
        PriceLevel bid = getBestBid();
        PriceLevel ask = getBestAsk();
        return bid != null && ask != null && bid.getPrice().compareTo(ask.getPrice()) >= 0;
    }

    /**
     * Full consistency check between ledger and ladder. O(orders).
     *
     * @throws BookInvariantViolationException describing the first inconsistency found
     */
    public void verifyInvariants() {
        if (isCrossed()) {
            throw new BookInvariantViolationException("Book crossed: bid " + getBestBid().getPrice()
                    + " >= ask " + getBestAsk().getPrice());
        }
        int queued = 0;
        for (Side side : Side.values()) {
            for (PriceLevel level : ladder.levels(side)) {
                if (level.isEmpty()) {
                    throw new BookInvariantViolationException("Empty " + side + " level at " + level.getPrice());
                }
                long previousSequence = Long.MIN_VALUE;
                for (OrderId id : level.getOrderIds()) {
                    Order order = ledger.find(id);
                    if (order == null) {
                        throw new BookInvariantViolationException("Queued order " + id + " missing from ledger");
                    }
                    if (order.getSide() != side || !order.getLimitPrice().equals(level.getPrice())) {
                        throw new BookInvariantViolationException(
                                "Order " + order + " queued at " + side + " " + level.getPrice());
                    }
                    if (order.getRemainingQuantity() <= 0
                            || order.getRemainingQuantity() > order.getOriginalQuantity()) {
                        throw new BookInvariantViolationException("Order " + order + " has invalid remaining");
                    }
                    if (order.getSequence() <= previousSequence) {
                        throw new BookInvariantViolationException(
                                "Time priority broken at " + side + " " + level.getPrice() + " by " + order);
                    }
                    previousSequence = order.getSequence();
                    queued++;
                }
            }
        }
        if (queued != ledger.size()) {
            throw new BookInvariantViolationException(
                    "Ledger holds " + ledger.size() + " orders but ladder queues " + queued);
        }
    }

    /** Total resting orders on the bid side. */
    public int getBidDepth() {
        return ladder.orderCount(Side.BUY);
    }

    /** Total resting orders on the ask side. */
    public int getAskDepth() {
        return ladder.orderCount(Side.SELL);
    }

    public int getBidLevelCount() {
        return ladder.levelCount(Side.BUY);
    }

    public int getAskLevelCount() {
        return ladder.levelCount(Side.SELL);
    }

    public boolean isEmpty() {
        return ledger.isEmpty() && ladder.isEmpty();
    }

    public OrderLedger getLedger() {
        return ledger;
    }

    public PriceLadder getLadder() {
        return ladder;
    }
}
