package com.flagship.mill_sync.sync;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.flagship.mill_sync.common.EntityRef;
import com.flagship.mill_sync.common.EntityType;
import com.flagship.mill_sync.queue.MutationOperation;
import com.flagship.mill_sync.queue.MutationRecord;
import com.flagship.mill_sync.queue.payload.CustomerPayload;
import com.flagship.mill_sync.queue.payload.DeletePayload;
import com.flagship.mill_sync.queue.payload.InventoryItemPayload;
import com.flagship.mill_sync.queue.payload.MillingPayload;
import com.flagship.mill_sync.queue.payload.MutationPayload;
import com.flagship.mill_sync.queue.payload.PaymentPayload;
import com.flagship.mill_sync.queue.payload.StockMovementPayload;
import com.flagship.mill_sync.queue.payload.TransactionCancelPayload;
import com.flagship.mill_sync.queue.payload.TransactionPayload;
import com.flagship.mill_sync.remote.RemoteRequest;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Turns a mutation record into the remote call that carries it.
 *
 * Bodies use snake_case keys and carry the device-local id, so the remote
 * can answer batch creates by local id. Local references are replaced by
 * the server ids resolved at send time; the caller makes sure they exist.
 * Every request carries the record id as its idempotency key.
 */
@Component
public class RemoteRequestFactory {

    private static final Set<Class<? extends MutationPayload>> BATCHABLE =
            Set.of(CustomerPayload.class, InventoryItemPayload.class, TransactionPayload.class);

    private final ObjectMapper wireMapper;
    private final LedgerRegistry registry;

    public RemoteRequestFactory(ObjectMapper objectMapper, LedgerRegistry registry) {
        this.wireMapper = objectMapper.copy().setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.registry = registry;
    }

    public RemoteRequest build(MutationRecord record) {
        MutationPayload payload = record.getPayload();
        String key = record.getId().toString();

        if (payload instanceof DeletePayload) {
            return RemoteRequest.delete(collection(record.getEntityType()) + "/" + ownServerId(record), key);
        }
        if (payload instanceof StockMovementPayload movement) {
            String path = "/inventory/" + ownServerId(record) + "/movements";
            return RemoteRequest.post(path, movementBody(movement), key);
        }
        if (payload instanceof TransactionCancelPayload) {
            String path = "/transactions/" + ownServerId(record) + "/cancel";
            return RemoteRequest.post(path, tree(payload), key);
        }
        if (payload instanceof PaymentPayload payment) {
            String transactionId = serverId(EntityRef.of(EntityType.TRANSACTION, payment.getTransactionLocalId()));
            return RemoteRequest.post("/transactions/" + transactionId + "/payments", createBody(record), key);
        }
        if (record.getOperation() == MutationOperation.CREATE) {
            return RemoteRequest.post(collection(record.getEntityType()), createBody(record), key);
        }
        return RemoteRequest.put(collection(record.getEntityType()) + "/" + ownServerId(record),
                createBody(record), key);
    }

    /**
     * Creates that may travel together in one batch call.
     */
    public boolean isBatchable(MutationRecord record) {
        return record.getOperation() == MutationOperation.CREATE
                && BATCHABLE.contains(record.getPayload().getClass());
    }

    /**
     * One batch create for records of the same entity type, answered with
     * {@code {"synced": [{"local_id": .., "id": ..}]}}.
     */
    public RemoteRequest buildBatch(EntityType type, List<MutationRecord> records) {
        ObjectNode body = wireMapper.createObjectNode();
        ArrayNode items = body.putArray(batchKey(type));
        for (MutationRecord record : records) {
            items.add(createBody(record));
        }
        String ids = records.stream().map(r -> r.getId().toString()).collect(Collectors.joining(","));
        String key = UUID.nameUUIDFromBytes(ids.getBytes(StandardCharsets.UTF_8)).toString();
        return RemoteRequest.post(collection(type) + "/batch", body, key);
    }

    public static String collection(EntityType type) {
        return switch (type) {
            case CUSTOMER -> "/customers";
            case INVENTORY -> "/inventory";
            case TRANSACTION -> "/transactions";
            case PAYMENT -> "/payments";
            case MILLING -> "/milling";
            case USER -> "/users";
        };
    }

    static String batchKey(EntityType type) {
        return switch (type) {
            case CUSTOMER -> "customers";
            case INVENTORY -> "inventory";
            case TRANSACTION -> "transactions";
            default -> throw new IllegalArgumentException("No batch endpoint for " + type);
        };
    }

    ObjectNode createBody(MutationRecord record) {
        MutationPayload payload = record.getPayload();
        ObjectNode body = tree(payload);
        body.put("local_id", record.getEntityId());

        if (payload instanceof TransactionPayload transaction) {
            body.put("customer_id", serverId(EntityRef.of(EntityType.CUSTOMER, transaction.getCustomerLocalId())));
            JsonNode lines = body.remove("lines");
            ArrayNode items = body.putArray("items");
            if (lines != null) {
                for (JsonNode line : lines) {
                    ObjectNode item = (ObjectNode) line.deepCopy();
                    long itemLocalId = line.get("inventory_item_local_id").asLong();
                    item.put("local_id", line.get("line_local_id").asLong());
                    item.put("inventory_item_id", serverId(EntityRef.of(EntityType.INVENTORY, itemLocalId)));
                    items.add(item);
                }
            }
        } else if (payload instanceof PaymentPayload payment) {
            body.put("transaction_id", serverId(EntityRef.of(EntityType.TRANSACTION, payment.getTransactionLocalId())));
        } else if (payload instanceof MillingPayload milling) {
            body.put("paddy_item_id", serverId(EntityRef.of(EntityType.INVENTORY, milling.getPaddyItemLocalId())));
            body.put("rice_item_id", serverId(EntityRef.of(EntityType.INVENTORY, milling.getRiceItemLocalId())));
        }
        return body;
    }

    private ObjectNode movementBody(StockMovementPayload movement) {
        ObjectNode body = tree(movement);
        body.remove("reference");
        body.put("local_id", movement.getMovementLocalId());
        if (movement.getReference() != null) {
            body.put("reference_type", movement.getReference().getType().name());
            body.put("reference_id", serverId(movement.getReference()));
        }
        return body;
    }

    private ObjectNode tree(MutationPayload payload) {
        ObjectNode body = wireMapper.valueToTree(payload);
        body.remove("kind");
        return body;
    }

    private String ownServerId(MutationRecord record) {
        if (record.getEntityServerId() != null) {
            return record.getEntityServerId();
        }
        return serverId(record.getEntityRef());
    }

    private String serverId(EntityRef ref) {
        return registry.serverIdOf(ref)
                .orElseThrow(() -> new IllegalStateException("No server id yet for " + ref));
    }
}
