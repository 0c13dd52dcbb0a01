package dumb.metamath;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static dumb.metamath.MetamathException.Kind.DUPLICATE_LABEL;
import static dumb.metamath.MetamathException.Kind.MALFORMED;
import static dumb.metamath.MetamathException.Kind.NOT_FOUND;
import static java.util.Objects.requireNonNull;

/**
 * Label, short code and external code indices for the entities of one formal system or session.
 * Variables bound by assertions live in a separate index, so their names never occupy a global label.
 * Mutation and lookup are serialized by a read/write lock; the indexed entities are immutable.
 */
public class Registry {
    private static final Logger logger = LoggerFactory.getLogger(Registry.class);

    private final Map<String, Labeled> labels = new LinkedHashMap<>();
    private final Map<String, Labeled> shortCodes = new HashMap<>();
    private final Map<String, Labeled> externalCodes = new HashMap<>();
    private final Map<String, Variable> bound = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public <X extends Labeled> X register(X entity) {
        requireNonNull(entity);
        var label = entity.label();
        if (label == null || label.isBlank())
            throw new MetamathException(MALFORMED, "Cannot register an unlabeled entity: " + entity);
        var shortCode = entity.shortCode();
        var externalCode = entity.externalCode();
        lock.writeLock().lock();
        try {
            if (labels.containsKey(label))
                throw new MetamathException(DUPLICATE_LABEL, "Label already registered: " + label);
            if (shortCode != null && shortCodes.containsKey(shortCode))
                throw new MetamathException(DUPLICATE_LABEL, "Short code already registered: " + shortCode + " (" + label + ")");
            if (externalCode != null && externalCodes.containsKey(externalCode))
                throw new MetamathException(DUPLICATE_LABEL, "External code already registered: " + externalCode + " (" + label + ")");
            labels.put(label, entity);
            if (shortCode != null) shortCodes.put(shortCode, entity);
            if (externalCode != null) externalCodes.put(externalCode, entity);
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Registered {} '{}'", entity.getClass().getSimpleName(), label);
        return entity;
    }

    public Labeled lookup(String label) {
        return find(label).orElseThrow(() -> new MetamathException(NOT_FOUND, "No entity labeled: " + label));
    }

    public <X extends Labeled> X lookup(String label, Class<X> type) {
        var e = lookup(label);
        if (!type.isInstance(e))
            throw new MetamathException(NOT_FOUND, "'" + label + "' is a " + e.getClass().getSimpleName() + ", not a " + type.getSimpleName());
        return type.cast(e);
    }

    public Optional<Labeled> find(String label) {
        return read(labels, label);
    }

    public Optional<Labeled> findByShortCode(String shortCode) {
        return read(shortCodes, shortCode);
    }

    public Optional<Labeled> findByExternalCode(String externalCode) {
        return read(externalCodes, externalCode);
    }

    public boolean contains(String label) {
        return find(label).isPresent();
    }

    /** Drops the entity from every index at once. */
    public Labeled remove(String label) {
        Labeled removed;
        lock.writeLock().lock();
        try {
            removed = labels.remove(label);
            if (removed == null)
                throw new MetamathException(NOT_FOUND, "No entity labeled: " + label);
            if (removed.shortCode() != null) shortCodes.remove(removed.shortCode());
            if (removed.externalCode() != null) externalCodes.remove(removed.externalCode());
        } finally {
            lock.writeLock().unlock();
        }
        logger.debug("Removed {} '{}'", removed.getClass().getSimpleName(), label);
        return removed;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return labels.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Constant constant(String label) {
        return register(new Constant(label));
    }

    public Constant constant(String label, @Nullable String shortCode, @Nullable String externalCode) {
        return register(new Constant(label, shortCode, externalCode));
    }

    public Variable variable(String label) {
        return register(new Variable(label));
    }

    public Variable variable(String label, @Nullable String shortCode, @Nullable String externalCode) {
        return register(new Variable(label, shortCode, externalCode));
    }

    /** Registered formula built from symbols and nested formulas, flattened in order. */
    public Formula formula(String label, Object... parts) {
        return register(new Formula(requireNonNull(label), Formula.flatten(List.of(parts))));
    }

    public FormulaVariable formulaVariable(String label) {
        return register(new FormulaVariable(label));
    }

    /** A bound variable interned by an assertion, or a registered {@link Variable} of that label. */
    public Optional<Variable> findVariable(String label) {
        lock.readLock().lock();
        try {
            var v = bound.get(label);
            if (v != null) return Optional.of(v);
            return labels.get(label) instanceof Variable registered ? Optional.of(registered) : Optional.empty();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * The variable an assertion binds under this name: a registered {@link Variable} if there is one,
     * otherwise a shared bound variable kept outside the label index.
     */
    Variable intern(String label) {
        lock.writeLock().lock();
        try {
            var existing = labels.get(label);
            if (existing instanceof Variable v) return v;
            if (existing != null)
                throw new MetamathException(MALFORMED, "'" + label + "' is a " + existing.getClass().getSimpleName() + ", not a variable");
            return bound.computeIfAbsent(label, Variable::new);
        } finally {
            lock.writeLock().unlock();
        }
    }

    private Optional<Labeled> read(Map<String, Labeled> index, String key) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(index.get(key));
        } finally {
            lock.readLock().unlock();
        }
    }
}
