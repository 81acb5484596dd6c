package com.supperclub.reservation.payment;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.supperclub.common.exception.BusinessException;
import com.supperclub.common.response.ErrorCode;
import com.supperclub.reservation.domain.BookingSelection;
import com.supperclub.reservation.domain.SelectionKind;
import com.supperclub.reservation.service.PaidCheckout;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Reads gateway JSON. Checkout metadata values are strings; list fields arrive
 * as JSON text inside those strings.
 */
@Component
@RequiredArgsConstructor
public class PaymentWebhookParser {

    private static final Map<String, SelectionKind> COURSE_KEYS = Map.of(
            "salad", SelectionKind.SALAD,
            "entree", SelectionKind.ENTREE,
            "dessert", SelectionKind.DESSERT);

    private static final String TICKET_ONLY = "ticket-only";

    private final ObjectMapper objectMapper;

    public PaymentGatewayEvent parse(String payload) {
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (JsonProcessingException e) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_PAYLOAD, "Webhook body is not valid JSON");
        }
        String id = root.path("id").asText("");
        String type = root.path("type").asText("");
        JsonNode object = root.path("data").path("object");
        if (id.isBlank() || type.isBlank() || !object.isObject()) {
            throw new BusinessException(ErrorCode.INVALID_WEBHOOK_PAYLOAD, "Webhook body lacks id, type or data.object");
        }
        return new PaymentGatewayEvent(id, type, object);
    }

    public boolean hasReservationMetadata(PaymentGatewayEvent event) {
        JsonNode metadata = event.metadata();
        return metadata.hasNonNull("eventId")
                && (metadata.hasNonNull("tableId") || isTicketPurchase(metadata));
    }

    /**
     * Builds the settlement command from a paid checkout session or payment intent.
     */
    public PaidCheckout toPaidCheckout(PaymentGatewayEvent event) {
        JsonNode metadata = event.metadata();
        if (!metadata.isObject()) {
            throw new InvalidMetadataException("Payment carries no metadata");
        }
        Long eventId = requiredLong(metadata, "eventId");
        boolean ticketPurchase = isTicketPurchase(metadata);
        Long tableId = ticketPurchase ? null : requiredLong(metadata, "tableId");
        String userId = text(metadata, "userId");
        if (userId == null) {
            throw new InvalidMetadataException("Metadata field userId is missing");
        }

        List<Integer> seats = ticketPurchase ? List.of() : parseSeats(text(metadata, "seats"));
        int partySize;
        if (ticketPurchase) {
            partySize = (int) requiredLong(metadata, "quantity").longValue();
            if (partySize < 1) {
                throw new InvalidMetadataException("Metadata field quantity must be at least 1");
            }
        } else if (metadata.hasNonNull("partySize")) {
            partySize = (int) requiredLong(metadata, "partySize").longValue();
        } else {
            partySize = Math.max(1, seats.size());
        }

        List<BookingSelection> selections = new ArrayList<>();
        selections.addAll(parseFoodSelections(text(metadata, "foodSelections")));
        selections.addAll(parseWineSelections(text(metadata, "wineSelections")));

        boolean checkoutSession = PaymentGatewayEvent.CHECKOUT_COMPLETED.equals(event.type());
        String paymentReference = checkoutSession ? event.text("payment_intent") : event.text("id");
        if (paymentReference == null) {
            paymentReference = event.text("id");
        }
        String sessionId = checkoutSession ? event.text("id") : null;
        String customerEmail = event.object().path("customer_details").path("email").asText(null);
        if (customerEmail == null) {
            customerEmail = text(metadata, "customerEmail");
        }

        return new PaidCheckout(
                eventId,
                tableId,
                userId,
                partySize,
                seats,
                parseStringList(text(metadata, "guestNames"), "guestNames"),
                selections,
                customerEmail,
                text(metadata, "lockToken"),
                paymentReference,
                sessionId,
                event.amount("amount_total", "amount_received", "amount"));
    }

    private static boolean isTicketPurchase(JsonNode metadata) {
        return TICKET_ONLY.equals(text(metadata, "eventType"));
    }

    private List<BookingSelection> parseFoodSelections(String json) {
        List<BookingSelection> result = new ArrayList<>();
        for (JsonNode entry : readArray(json, "foodSelections")) {
            if (entry.hasNonNull("kind")) {
                if (entry.hasNonNull("itemId")) {
                    result.add(new BookingSelection(parseKind(entry.get("kind").asText()),
                            entry.get("itemId").asText(), entry.path("name").asText(null),
                            entry.path("quantity").asInt(1)));
                }
                continue;
            }
            // one object per guest: {"salad": 3, "entree": 7, "dessert": 2}
            COURSE_KEYS.forEach((key, kind) -> {
                if (entry.hasNonNull(key)) {
                    result.add(new BookingSelection(kind, entry.get(key).asText(), null, 1));
                }
            });
        }
        return result;
    }

    private List<BookingSelection> parseWineSelections(String json) {
        List<BookingSelection> result = new ArrayList<>();
        for (JsonNode entry : readArray(json, "wineSelections")) {
            if (!entry.hasNonNull("id")) {
                continue;
            }
            result.add(new BookingSelection(SelectionKind.WINE,
                    entry.get("id").asText(),
                    entry.path("name").asText(null),
                    entry.path("quantity").asInt(1)));
        }
        return result;
    }

    private List<String> parseStringList(String json, String field) {
        List<String> result = new ArrayList<>();
        for (JsonNode entry : readArray(json, field)) {
            result.add(entry.asText());
        }
        return result;
    }

    private JsonNode[] readArray(String json, String field) {
        if (json == null || json.isBlank()) {
            return new JsonNode[0];
        }
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.isArray()) {
                throw new InvalidMetadataException("Metadata field " + field + " is not a JSON array");
            }
            JsonNode[] items = new JsonNode[node.size()];
            for (int i = 0; i < node.size(); i++) {
                items[i] = node.get(i);
            }
            return items;
        } catch (JsonProcessingException e) {
            throw new InvalidMetadataException("Metadata field " + field + " is not valid JSON", e);
        }
    }

    private static List<Integer> parseSeats(String csv) {
        if (csv == null || csv.isBlank()) {
            return List.of();
        }
        try {
            return Arrays.stream(csv.split(","))
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(Integer::valueOf)
                    .toList();
        } catch (NumberFormatException e) {
            throw new InvalidMetadataException("Metadata field seats is not a number list: " + csv, e);
        }
    }

    private static SelectionKind parseKind(String value) {
        try {
            return SelectionKind.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new InvalidMetadataException("Unknown selection kind: " + value, e);
        }
    }

    private static Long requiredLong(JsonNode metadata, String field) {
        String value = text(metadata, field);
        if (value == null) {
            throw new InvalidMetadataException("Metadata field " + field + " is missing");
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new InvalidMetadataException("Metadata field " + field + " is not a number: " + value, e);
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }
}
