package com.example.reme.services;

import com.example.reme.model.InventoryAlert;
import com.example.reme.model.InventoryItem;
import com.example.reme.model.RecipeIngredient;
import com.example.reme.storage.RecordNotFoundException;
import com.example.reme.storage.RecordStore;
import com.example.reme.storage.Stores;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.*;

/**
 * The user's stock. Adding an ingredient to a location that already holds it folds the
 * quantities together; consuming drains the preferred location first, then the batches that
 * expire soonest.
 */
public class InventoryService {
    private static final Logger log = LoggerFactory.getLogger(InventoryService.class);
    public static final int EXPIRING_SOON_DAYS = 2;

    public static class ConsumeResult {
        public final double consumed;
        public final double remaining;
        public ConsumeResult(double consumed, double remaining) { this.consumed = consumed; this.remaining = remaining; }
    }

    public static class QuantitySummary {
        public final double total;
        public final String unit;                        // unit of the first batch; empty when none
        public final Map<String, Double> byLocation;
        public QuantitySummary(double total, String unit, Map<String, Double> byLocation) {
            this.total = total; this.unit = unit; this.byLocation = byLocation;
        }
    }

    public static class IngredientCheck {
        public final String ingredientId;
        public final double required;
        public final double available;
        public IngredientCheck(String ingredientId, double required, double available) {
            this.ingredientId = ingredientId; this.required = required; this.available = available;
        }
        public double shortage() { return Math.max(0, required - available); }
    }

    public static class RecipeAvailability {
        public final List<IngredientCheck> available = new ArrayList<>();
        public final List<IngredientCheck> missing = new ArrayList<>();
        public final List<IngredientCheck> optional = new ArrayList<>();
        public boolean canMake() { return missing.isEmpty(); }
    }

    private final RecordStore store;
    private final IngredientService ingredients;
    private final Units units;
    private final Clock clock;

    public InventoryService(RecordStore store, IngredientService ingredients, Units units, Clock clock) {
        this.store = store;
        this.ingredients = ingredients;
        this.units = units;
        this.clock = clock;
    }

    public List<InventoryItem> getAll() {
        return store.getAll(Stores.INVENTORY, InventoryItem.class);
    }

    /** Optionally restricted to one location and to items expiring within the given days. */
    public List<InventoryItem> getInventory(String location, Integer expiringWithinDays) {
        List<InventoryItem> items = location != null ? getByLocation(location) : getAll();
        if (expiringWithinDays == null) return items;
        LocalDate limit = today().plusDays(expiringWithinDays);
        List<InventoryItem> out = new ArrayList<>();
        for (InventoryItem i : items) if (i.expirationDate != null && !i.expirationDate.isAfter(limit)) out.add(i);
        return out;
    }

    public Optional<InventoryItem> getById(String id) {
        return store.get(Stores.INVENTORY, id, InventoryItem.class);
    }

    public List<InventoryItem> getByIngredientId(String ingredientId) {
        return store.getByIndex(Stores.INVENTORY, "ingredientId", ingredientId, InventoryItem.class);
    }

    public List<InventoryItem> getByLocation(String location) {
        return store.getByIndex(Stores.INVENTORY, "location", location, InventoryItem.class);
    }

    /**
     * Stores a new batch, or folds it into the item already holding the same ingredient at the
     * same location when the units are compatible. A later expiration date given here replaces
     * the stored one; a null one keeps it.
     */
    public InventoryItem add(InventoryItem item) {
        if (item.ingredientId == null) throw new IllegalArgumentException("ingredientId is required");
        if (item.quantity < 0) throw new IllegalArgumentException("quantity must not be negative");
        Instant now = clock.instant();
        for (InventoryItem existing : getByIngredientId(item.ingredientId)) {
            if (Objects.equals(existing.location, item.location) && unitsFold(existing.unit, item.unit)) {
                existing.quantity += units.convert(item.quantity, item.unit, existing.unit);
                if (item.expirationDate != null) existing.expirationDate = item.expirationDate;
                existing.updatedAt = now;
                store.put(Stores.INVENTORY, existing);
                log.debug("Folded {} {} into inventory item {}", item.quantity, item.unit, existing.id);
                return existing;
            }
        }
        if (item.id == null) item.id = Stores.newId("inv");
        if (item.purchaseDate == null) item.purchaseDate = today();
        item.createdAt = now;
        item.updatedAt = now;
        store.add(Stores.INVENTORY, item);
        log.info("Added {} {} of {} to {}", item.quantity, item.unit, item.ingredientId, item.location);
        return item;
    }

    /** @throws RecordNotFoundException when the item does not exist */
    public InventoryItem update(InventoryItem item) {
        if (item.id == null || getById(item.id).isEmpty()) {
            throw new RecordNotFoundException(Stores.INVENTORY, item.id, "Inventory item not found: " + item.id);
        }
        item.updatedAt = clock.instant();
        return store.put(Stores.INVENTORY, item);
    }

    public boolean delete(String id) {
        return store.delete(Stores.INVENTORY, id);
    }

    /**
     * Removes up to {@code amount} of an ingredient. Items emptied are deleted. Batches without
     * an expiration date go last.
     */
    public ConsumeResult consume(String ingredientId, double amount, String preferredLocation) {
        List<InventoryItem> items = getByIngredientId(ingredientId);
        if (items.isEmpty()) return new ConsumeResult(0, 0);

        Comparator<InventoryItem> order = Comparator.comparing(
                (InventoryItem i) -> preferredLocation == null || !preferredLocation.equals(i.location));
        order = order.thenComparing(i -> i.expirationDate, Comparator.nullsLast(Comparator.naturalOrder()));
        items.sort(order);

        double remaining = amount;
        double consumed = 0;
        for (InventoryItem item : items) {
            if (remaining <= 0) break;
            if (item.quantity <= remaining) {
                consumed += item.quantity;
                remaining -= item.quantity;
                delete(item.id);
            } else {
                consumed += remaining;
                item.quantity -= remaining;
                remaining = 0;
                update(item);
            }
        }
        double left = 0;
        for (InventoryItem i : getByIngredientId(ingredientId)) left += i.quantity;
        log.info("Consumed {} of {} ({} left)", consumed, ingredientId, left);
        return new ConsumeResult(consumed, left);
    }

    /** Items expiring within {@code days} from today, expired ones included. */
    public List<InventoryItem> getExpiring(int days) {
        return getInventory(null, days);
    }

    public List<InventoryItem> getLowStock() {
        List<InventoryItem> out = new ArrayList<>();
        for (InventoryItem i : getAll()) if (isLowStock(i)) out.add(i);
        return out;
    }

    /** Expired, expiring and low-stock alerts, high priority first. */
    public List<InventoryAlert> generateAlerts() {
        LocalDate today = today();
        List<InventoryAlert> alerts = new ArrayList<>();
        for (InventoryItem item : getAll()) {
            String name = ingredients.displayName(item.ingredientId);
            if (item.expirationDate != null) {
                long daysUntil = ChronoUnit.DAYS.between(today, item.expirationDate);
                if (daysUntil < 0) {
                    long ago = -daysUntil;
                    alerts.add(new InventoryAlert("alert-exp-" + item.id, InventoryAlert.Type.EXPIRED, item.ingredientId, name,
                            name + " ha caducado hace " + ago + (ago == 1 ? " día" : " días"), InventoryAlert.Priority.HIGH, today));
                } else if (daysUntil <= EXPIRING_SOON_DAYS) {
                    String message = daysUntil == 0 ? name + " caduca hoy"
                            : daysUntil == 1 ? name + " caduca mañana"
                            : name + " caduca en " + daysUntil + " días";
                    alerts.add(new InventoryAlert("alert-exp-" + item.id, InventoryAlert.Type.EXPIRING_SOON, item.ingredientId, name,
                            message, daysUntil == 0 ? InventoryAlert.Priority.HIGH : InventoryAlert.Priority.MEDIUM, today));
                }
            }
            if (isLowStock(item)) {
                boolean out = item.quantity == 0;
                alerts.add(new InventoryAlert("alert-stock-" + item.id, InventoryAlert.Type.LOW_STOCK, item.ingredientId, name,
                        out ? name + " está agotado" : name + " tiene poco stock (" + formatQuantity(item.quantity) + " " + item.unit + ")",
                        out ? InventoryAlert.Priority.HIGH : InventoryAlert.Priority.MEDIUM, today));
            }
        }
        alerts.sort(Comparator.comparing(a -> a.priority));
        return alerts;
    }

    /** Quantity across locations, expressed in the unit of the first batch where units allow. */
    public QuantitySummary getTotalQuantity(String ingredientId) {
        List<InventoryItem> items = getByIngredientId(ingredientId);
        if (items.isEmpty()) return new QuantitySummary(0, "", Map.of());
        String unit = items.get(0).unit;
        double total = 0;
        Map<String, Double> byLocation = new LinkedHashMap<>();
        for (InventoryItem i : items) {
            double q = units.convert(i.quantity, i.unit, unit);
            total += q;
            byLocation.merge(i.location, q, Double::sum);
        }
        return new QuantitySummary(total, unit, byLocation);
    }

    /** Splits a recipe's ingredient lines into available, missing and optional against current stock. */
    public RecipeAvailability checkRecipeIngredients(List<RecipeIngredient> lines) {
        RecipeAvailability result = new RecipeAvailability();
        for (RecipeIngredient line : lines) {
            QuantitySummary have = getTotalQuantity(line.ingredientId);
            double required = have.unit.isEmpty() ? line.amount : units.convert(line.amount, line.unit, have.unit);
            IngredientCheck check = new IngredientCheck(line.ingredientId, required, have.total);
            if (line.optional) result.optional.add(check);
            else if (have.total >= required && have.total > 0) result.available.add(check);
            else result.missing.add(check);
        }
        return result;
    }

    private boolean unitsFold(String a, String b) {
        if (a == null || b == null) return Objects.equals(a, b);
        return units.areCompatible(a, b);
    }

    private static boolean isLowStock(InventoryItem i) {
        return i.lowStockThreshold != null && i.quantity <= i.lowStockThreshold;
    }

    private static String formatQuantity(double q) {
        return q == Math.rint(q) ? String.valueOf((long) q) : String.valueOf(q);
    }

    private LocalDate today() { return LocalDate.now(clock); }
}
