package com.orderbook.publishing;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.orderbook.outcome.Ack;
import com.orderbook.outcome.Cancelled;
import com.orderbook.outcome.Flushed;
import com.orderbook.outcome.OutcomeRecord;
import com.orderbook.outcome.Rejected;
import com.orderbook.outcome.TopOfBook;
import com.orderbook.outcome.Trade;

/**
 * One compact JSON object per record, discriminated by "type". Absent values are written as null.
 */
public class JsonOutcomeFormatter implements OutcomeFormatter, OutcomeRecord.Visitor<JsonObject> {

    private final Gson gson = new GsonBuilder().serializeNulls().create();

    @Override
    public String format(OutcomeRecord record) {
        return gson.toJson(record.accept(this));
    }

    @Override
    public JsonObject visitAck(Ack ack) {
        JsonObject json = typed("ACK");
        json.addProperty("orderId", ack.orderId().value());
        json.addProperty("filledQuantity", ack.filledQuantity());
        json.addProperty("restingQuantity", ack.restingQuantity());
        return json;
    }

    @Override
    public JsonObject visitTrade(Trade trade) {
        JsonObject json = typed("TRADE");
        json.addProperty("takerOrderId", trade.takerOrderId().value());
        json.addProperty("makerOrderId", trade.makerOrderId().value());
        json.addProperty("price", trade.price().minorUnits());
        json.addProperty("quantity", trade.quantity());
        return json;
    }

    @Override
    public JsonObject visitCancelled(Cancelled cancelled) {
        JsonObject json = typed("CANCELLED");
        json.addProperty("orderId", cancelled.orderId().value());
        return json;
    }

    @Override
    public JsonObject visitFlushed(Flushed flushed) {
        return typed("FLUSHED");
    }

    @Override
    public JsonObject visitRejected(Rejected rejected) {
        JsonObject json = typed("REJECTED");
        if (rejected.orderId() != null) {
            json.addProperty("orderId", rejected.orderId().value());
        } else {
            json.add("orderId", JsonNull.INSTANCE);
        }
        json.addProperty("reason", rejected.reason().label());
        return json;
    }

    @Override
    public JsonObject visitTopOfBook(TopOfBook top) {
        JsonObject json = typed("TOP_OF_BOOK");
        json.addProperty("side", top.side().name());
        if (top.isEmpty()) {
            json.add("price", JsonNull.INSTANCE);
        } else {
            json.addProperty("price", top.price().minorUnits());
        }
        json.addProperty("totalQuantity", top.totalQuantity());
        return json;
    }

    private static JsonObject typed(String type) {
        JsonObject json = new JsonObject();
        json.addProperty("type", type);
        return json;
    }
}
