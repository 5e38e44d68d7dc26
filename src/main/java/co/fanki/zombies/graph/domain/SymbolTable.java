package co.fanki.zombies.graph.domain;

import co.fanki.zombies.shared.Preconditions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Registry interning declaration facts into canonical {@link CodeSymbol}s.
 *
 * <p>Built for many concurrent parser workers: state is split into shards
 * chosen by hash, each guarded by its own lock. A symbol lives in the shard
 * of its id; the name indices live in the shard of the indexed name. A
 * writer never holds two shard locks at once.</p>
 *
 * <p>The table is an owned instance handed to every component that needs
 * it, so independent analysis runs never share symbol state.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class SymbolTable {

    private static final Logger LOG = LoggerFactory.getLogger(
            SymbolTable.class);

    /** Default shard count, a power of two. */
    public static final int DEFAULT_SHARDS = 64;

    private final Shard[] shards;
    private final int mask;
    private final SymbolQualifiers qualifiers;

    /**
     * Creates a table with the default shard count and qualifiers.
     */
    public SymbolTable() {
        this(DEFAULT_SHARDS, SymbolQualifiers.defaults());
    }

    /**
     * Creates a table.
     *
     * @param shardCount the number of shards, rounded up to a power of two
     * @param theQualifiers the per-language qualification adapters
     */
    public SymbolTable(final int shardCount,
            final SymbolQualifiers theQualifiers) {
        Preconditions.requirePositive(shardCount,
                "Shard count must be positive");
        Preconditions.requireNonNull(theQualifiers,
                "Qualifiers are required");
        final int size = Integer.highestOneBit(shardCount) == shardCount
                ? shardCount : Integer.highestOneBit(shardCount) << 1;
        this.shards = new Shard[size];
        for (int i = 0; i < size; i++) {
            shards[i] = new Shard();
        }
        this.mask = size - 1;
        this.qualifiers = theQualifiers;
    }

    /**
     * Interns a declaration of a file.
     *
     * <p>Idempotent: a second declaration with the same id returns the
     * symbol interned first.</p>
     *
     * @param declaration the declaration fact
     * @param file the file it was declared in
     * @return the canonical symbol
     */
    public CodeSymbol intern(final SymbolDeclaration declaration,
            final FileFacts file) {
        Preconditions.requireNonNull(declaration, "Declaration is required");
        Preconditions.requireNonNull(file, "File facts are required");

        final String qualified = qualifiers.qualify(declaration, file);
        final SymbolId id = SymbolId.of(file.repository(), file.filePath(),
                qualified);

        return upsert(new CodeSymbol(id.value(), declaration.name(),
                qualified, declaration.kind(), file.repository(), id.path(),
                file.language(), declaration.range(),
                declaration.visibility(), null, false,
                declaration.metadata()));
    }

    /**
     * Returns the declared database entity with the given name, or interns
     * a phantom placeholder for it.
     *
     * @param kind {@link SymbolKind#DB_TABLE} or
     *        {@link SymbolKind#STORED_PROCEDURE}
     * @param name the referenced name, optionally schema-qualified
     * @return the declared symbol or the phantom
     */
    public CodeSymbol databaseEntityOrPhantom(final SymbolKind kind,
            final String name) {
        Preconditions.requireNonBlank(name, "Entity name is required");
        return databaseEntity(kind, name)
                .orElseGet(() -> upsert(CodeSymbol.phantomOf(kind, name)));
    }

    /**
     * Looks up a declared (non-phantom) database entity by name.
     *
     * <p>Matching is case-insensitive. A schema-qualified name that does
     * not match falls back to its last segment. The earliest declaration
     * wins when several repositories declare the same entity.</p>
     *
     * @param kind the entity kind
     * @param name the name, optionally schema-qualified
     * @return the entity, empty if never declared
     */
    public Optional<CodeSymbol> databaseEntity(final SymbolKind kind,
            final String name) {
        final String key = name.toLowerCase(Locale.ROOT);
        Optional<CodeSymbol> found = firstDeclared(databaseCandidates(key),
                kind);
        final int dot = key.lastIndexOf('.');
        if (found.isEmpty() && dot > 0) {
            found = firstDeclared(databaseCandidates(key.substring(dot + 1)),
                    kind);
        }
        return found;
    }

    /**
     * Inserts a symbol if no symbol with its id exists yet.
     *
     * @param candidate the symbol
     * @return the symbol stored under the id after the call
     */
    public CodeSymbol upsert(final CodeSymbol candidate) {
        Preconditions.requireNonNull(candidate, "Symbol is required");

        final Shard shard = shardFor(candidate.id());
        final CodeSymbol stored;
        final boolean inserted;
        shard.lock.lock();
        try {
            final CodeSymbol existing = shard.byId.get(candidate.id());
            if (existing == null) {
                shard.byId.put(candidate.id(), candidate);
                stored = candidate;
                inserted = true;
            } else {
                stored = existing;
                inserted = false;
            }
        } finally {
            shard.lock.unlock();
        }

        if (inserted) {
            index(candidate);
        }
        return stored;
    }

    /**
     * Marks the symbols named by the designations as active roots.
     *
     * <p>A designation matches by full id or by qualified name; a qualified
     * name declared in several repositories marks all of them.</p>
     *
     * @param designations the root designations
     * @return the designations that matched no symbol
     */
    public List<RootDesignation> designateRoots(
            final Collection<RootDesignation> designations) {
        Preconditions.requireNonNull(designations,
                "Designations are required");

        final List<RootDesignation> unmatched = new ArrayList<>();
        for (final RootDesignation designation : designations) {
            final String name = designation.qualifiedSymbolName();
            final List<CodeSymbol> targets = find(name)
                    .map(List::of)
                    .orElseGet(() -> byQualifiedName(name));
            if (targets.isEmpty()) {
                unmatched.add(designation);
                continue;
            }
            for (final CodeSymbol target : targets) {
                replace(target.asRoot(designation.rootType()));
            }
        }
        if (!unmatched.isEmpty()) {
            LOG.warn("{} root designations matched no symbol",
                    unmatched.size());
        }
        return unmatched;
    }

    /**
     * Returns the symbol with the given id.
     *
     * @param id the global id
     * @return the symbol, empty if unknown
     */
    public Optional<CodeSymbol> find(final String id) {
        if (id == null) {
            return Optional.empty();
        }
        final Shard shard = shardFor(id);
        shard.lock.lock();
        try {
            return Optional.ofNullable(shard.byId.get(id));
        } finally {
            shard.lock.unlock();
        }
    }

    /**
     * Returns every symbol whose qualified name equals the given name.
     *
     * @param qualifiedName the qualified name
     * @return the matching symbols in declaration order
     */
    public List<CodeSymbol> byQualifiedName(final String qualifiedName) {
        return resolveIds(lookup(qualifiedName, NameIndex.QUALIFIED));
    }

    /**
     * Returns every symbol whose simple name equals the given name.
     *
     * @param simpleName the simple name
     * @return the matching symbols in declaration order
     */
    public List<CodeSymbol> bySimpleName(final String simpleName) {
        return resolveIds(lookup(simpleName, NameIndex.SIMPLE));
    }

    /**
     * Returns the candidate targets of a textual reference.
     *
     * <p>Tries, in order, the exact id, the qualified name and the simple
     * name (the last segment of a dotted or {@code ::} name). The first
     * level that yields candidates wins.</p>
     *
     * @param text the reference target as written
     * @return the candidates in declaration order, empty if unresolved
     */
    public List<CodeSymbol> candidates(final String text) {
        final Optional<CodeSymbol> exact = find(text);
        if (exact.isPresent()) {
            return List.of(exact.get());
        }
        final List<CodeSymbol> qualified = byQualifiedName(text);
        if (!qualified.isEmpty()) {
            return qualified;
        }
        return bySimpleName(lastSegment(text));
    }

    /**
     * Returns a snapshot of every symbol, sorted by id.
     *
     * @return the symbols
     */
    public List<CodeSymbol> all() {
        final List<CodeSymbol> result = new ArrayList<>();
        for (final Shard shard : shards) {
            shard.lock.lock();
            try {
                result.addAll(shard.byId.values());
            } finally {
                shard.lock.unlock();
            }
        }
        result.sort(Comparator.comparing(CodeSymbol::id));
        return result;
    }

    /**
     * Returns the number of interned symbols.
     *
     * @return the symbol count
     */
    public int size() {
        int size = 0;
        for (final Shard shard : shards) {
            shard.lock.lock();
            try {
                size += shard.byId.size();
            } finally {
                shard.lock.unlock();
            }
        }
        return size;
    }

    /**
     * Returns the number of shards.
     *
     * @return the shard count
     */
    public int shardCount() {
        return shards.length;
    }

    static String lastSegment(final String text) {
        final int dot = text.lastIndexOf('.');
        final int colons = text.lastIndexOf(SymbolId.SEPARATOR);
        if (colons > dot) {
            return text.substring(colons + SymbolId.SEPARATOR.length());
        }
        return dot < 0 ? text : text.substring(dot + 1);
    }

    private void replace(final CodeSymbol symbol) {
        final Shard shard = shardFor(symbol.id());
        shard.lock.lock();
        try {
            shard.byId.put(symbol.id(), symbol);
        } finally {
            shard.lock.unlock();
        }
    }

    private void index(final CodeSymbol symbol) {
        addToIndex(symbol.qualifiedName(), NameIndex.QUALIFIED, symbol.id());
        addToIndex(symbol.name(), NameIndex.SIMPLE, symbol.id());
        if (symbol.kind().isDatabaseEntity() && !symbol.phantom()) {
            addToIndex(symbol.name().toLowerCase(Locale.ROOT),
                    NameIndex.DATABASE, symbol.id());
            addToIndex(symbol.qualifiedName().toLowerCase(Locale.ROOT),
                    NameIndex.DATABASE, symbol.id());
        }
    }

    private void addToIndex(final String name, final NameIndex index,
            final String id) {
        final Shard shard = shardFor(name);
        shard.lock.lock();
        try {
            shard.names(index).computeIfAbsent(name, k -> new HashSet<>())
                    .add(id);
        } finally {
            shard.lock.unlock();
        }
    }

    private Set<String> lookup(final String name, final NameIndex index) {
        if (name == null || name.isBlank()) {
            return Set.of();
        }
        final Shard shard = shardFor(name);
        shard.lock.lock();
        try {
            final Set<String> ids = shard.names(index).get(name);
            return ids == null ? Set.of() : Set.copyOf(ids);
        } finally {
            shard.lock.unlock();
        }
    }

    private List<CodeSymbol> databaseCandidates(final String key) {
        return resolveIds(lookup(key, NameIndex.DATABASE));
    }

    private Optional<CodeSymbol> firstDeclared(
            final List<CodeSymbol> candidates, final SymbolKind kind) {
        return candidates.stream()
                .filter(s -> s.kind() == kind)
                .findFirst();
    }

    private List<CodeSymbol> resolveIds(final Set<String> ids) {
        final List<CodeSymbol> result = new ArrayList<>(ids.size());
        for (final String id : ids) {
            find(id).ifPresent(result::add);
        }
        result.sort(CodeSymbol.DECLARATION_ORDER);
        return result;
    }

    private Shard shardFor(final String key) {
        final int h = key.hashCode();
        return shards[(h ^ (h >>> 16)) & mask];
    }

    /** The name indices kept per shard. */
    private enum NameIndex {
        QUALIFIED,
        SIMPLE,
        DATABASE
    }

    /** One lock-guarded partition of the table. */
    private static final class Shard {

        private final ReentrantLock lock = new ReentrantLock();

        private final Map<String, CodeSymbol> byId = new HashMap<>();

        private final Map<String, Set<String>> qualifiedNames =
                new HashMap<>();

        private final Map<String, Set<String>> simpleNames = new HashMap<>();

        private final Map<String, Set<String>> databaseNames =
                new HashMap<>();

        private Map<String, Set<String>> names(final NameIndex index) {
            return switch (index) {
                case QUALIFIED -> qualifiedNames;
                case SIMPLE -> simpleNames;
                case DATABASE -> databaseNames;
            };
        }
    }

}
