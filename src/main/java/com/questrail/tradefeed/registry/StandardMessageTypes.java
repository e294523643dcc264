package com.questrail.tradefeed.registry;

/**
 * Default catalogue of inbound feed messages.
 *
 * <p>Covers market data, order and execution reports, account updates and the
 * connection-level {@code error} / {@code connectionClosed} notifications.
 * Hosts that model additional events build their own registry, optionally
 * starting from {@link #registry()} via
 * {@link MessageTypeRegistry.Builder#addAll(MessageTypeRegistry)}.</p>
 */
public final class StandardMessageTypes
{
    public static final MessageType TICK_PRICE =
            MessageType.of("tickPrice", "tickerId", "field", "price", "canAutoExecute");
    public static final MessageType TICK_SIZE =
            MessageType.of("tickSize", "tickerId", "field", "size");
    public static final MessageType TICK_STRING =
            MessageType.of("tickString", "tickerId", "tickType", "value");
    public static final MessageType TICK_GENERIC =
            MessageType.of("tickGeneric", "tickerId", "tickType", "value");

    public static final MessageType ORDER_STATUS =
            MessageType.of("orderStatus", "orderId", "status", "filled", "remaining",
                    "avgFillPrice", "permId", "parentId", "lastFillPrice", "clientId", "whyHeld");
    public static final MessageType OPEN_ORDER =
            MessageType.of("openOrder", "orderId", "contract", "order", "orderState");
    public static final MessageType OPEN_ORDER_END =
            MessageType.of("openOrderEnd");
    public static final MessageType NEXT_VALID_ID =
            MessageType.of("nextValidId", "orderId");
    public static final MessageType EXEC_DETAILS =
            MessageType.of("execDetails", "reqId", "contract", "execution");
    public static final MessageType EXEC_DETAILS_END =
            MessageType.of("execDetailsEnd", "reqId");

    public static final MessageType UPDATE_ACCOUNT_VALUE =
            MessageType.of("updateAccountValue", "key", "value", "currency", "accountName");
    public static final MessageType UPDATE_PORTFOLIO =
            MessageType.of("updatePortfolio", "contract", "position", "marketPrice", "marketValue",
                    "averageCost", "unrealizedPNL", "realizedPNL", "accountName");
    public static final MessageType UPDATE_ACCOUNT_TIME =
            MessageType.of("updateAccountTime", "timeStamp");
    public static final MessageType ACCOUNT_DOWNLOAD_END =
            MessageType.of("accountDownloadEnd", "accountName");
    public static final MessageType MANAGED_ACCOUNTS =
            MessageType.of("managedAccounts", "accountsList");

    public static final MessageType HISTORICAL_DATA =
            MessageType.of("historicalData", "reqId", "date", "open", "high", "low", "close",
                    "volume", "count", "WAP", "hasGaps");
    public static final MessageType CURRENT_TIME =
            MessageType.of("currentTime", "time");

    public static final MessageType CONNECTION_CLOSED =
            MessageType.of("connectionClosed");
    public static final MessageType ERROR =
            MessageType.of("error", "id", "errorCode", "errorMsg");

    private static final MessageTypeRegistry REGISTRY = MessageTypeRegistry.of(
            TICK_PRICE, TICK_SIZE, TICK_STRING, TICK_GENERIC,
            ORDER_STATUS, OPEN_ORDER, OPEN_ORDER_END, NEXT_VALID_ID,
            EXEC_DETAILS, EXEC_DETAILS_END,
            UPDATE_ACCOUNT_VALUE, UPDATE_PORTFOLIO, UPDATE_ACCOUNT_TIME,
            ACCOUNT_DOWNLOAD_END, MANAGED_ACCOUNTS,
            HISTORICAL_DATA, CURRENT_TIME,
            CONNECTION_CLOSED, ERROR
    );

    private StandardMessageTypes() {}

    public static MessageTypeRegistry registry() {
        return REGISTRY;
    }
}
