package dev.blanke.cobfuscator.transform.opaque;

import java.lang.System.Logger;
import java.lang.System.Logger.Level;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;

import org.jetbrains.annotations.Nullable;

import dev.blanke.cobfuscator.analysis.scope.NameAllocator;
import dev.blanke.cobfuscator.analysis.scope.ProgramPoint;
import dev.blanke.cobfuscator.ast.BlockItem;
import dev.blanke.cobfuscator.ast.CompoundStatement;
import dev.blanke.cobfuscator.ast.Declaration;
import dev.blanke.cobfuscator.ast.Expression;
import dev.blanke.cobfuscator.ast.FunctionDefinition;
import dev.blanke.cobfuscator.ast.IfStatement;
import dev.blanke.cobfuscator.ast.SourceUnit;
import dev.blanke.cobfuscator.ast.Statement;
import dev.blanke.cobfuscator.ast.StorageClass;
import dev.blanke.cobfuscator.ast.TreeVisitor;
import dev.blanke.cobfuscator.ast.Trees;
import dev.blanke.cobfuscator.ast.WhileStatement;
import dev.blanke.cobfuscator.transform.ObfuscatingTransformer;
import dev.blanke.cobfuscator.transform.Transform;

/**
 * Guards code with opaque predicates. Each function receives {@code number} predicates, distributed over the enabled
 * granularities, each guarding either the whole function body, a run of consecutive block items, or a single
 * statement in a construct of a randomly chosen {@link PredicateKind}.
 * <p>
 * Runs never contain statements carrying a {@code case} or {@code default} label of an enclosing {@code switch}, and
 * only contain declarations if they extend to the end of their block, so wrapping them cannot hide a declaration from
 * later uses.
 */
public final class OpaqueInsertion implements Transform {

    private static final Logger LOGGER = System.getLogger(OpaqueInsertion.class.getName());

    /**
     * The number of attempts at finding a free site per requested predicate.
     */
    private static final int ATTEMPTS = 8;

    private final Set<PredicateStyle> styles;

    private final Set<Granularity> granularities;

    private final Set<PredicateKind> kinds;

    private final int number;

    public OpaqueInsertion(final Set<PredicateStyle> styles,
                           final Set<Granularity>    granularities,
                           final Set<PredicateKind>  kinds,
                           final int                 number) {
        this.styles        = Set.copyOf(styles);
        this.granularities = Set.copyOf(granularities);
        this.kinds         = Set.copyOf(kinds);
        this.number        = number;
    }

    @Override
    public SourceUnit apply(final SourceUnit unit, final Random random) {
        if (styles.isEmpty() || granularities.isEmpty() || kinds.isEmpty() || number == 0)
            return unit;
        return new InsertingTransformer(unit, random).transform();
    }

    private static int weightOf(final Granularity granularity) {
        return switch (granularity) {
            case PROCEDURAL -> 10;
            case BLOCK      -> 70;
            case STATEMENT  -> 20;
        };
    }

    /**
     * A run of block items {@code [start, end)} of a compound statement of the original tree.
     */
    private record Site(int start, int end) {

        boolean overlaps(final Site other) {
            return start < other.end && other.start < end;
        }
    }

    private final class InsertingTransformer extends ObfuscatingTransformer {

        private final List<Granularity> granularityOrder = granularities.stream().sorted().toList();

        private final List<PredicateKind> kindOrder = kinds.stream().sorted().toList();

        private final PredicateSynthesizer predicates;

        private final BugGenerator bugs;

        private final Map<CompoundStatement, List<Site>> sites = new IdentityHashMap<>();

        InsertingTransformer(final SourceUnit unit, final Random random) {
            super(unit, random);
            final var names = new NameAllocator(scopes);
            predicates = new PredicateSynthesizer(scopes, expressions.getTypes(), names, random, styles);
            bugs       = new BugGenerator(expressions, names, random);
        }

        @Override
        public FunctionDefinition transformFunctionDefinition(final FunctionDefinition function) {
            final var original = function.body().items();
            if (original.isEmpty())
                return function;

            sites.clear();
            final var amounts = distribute();
            final var compounds = compoundsIn(function.body());
            int procedural = amounts.get(Granularity.PROCEDURAL);
            for (int i = 0; i < amounts.get(Granularity.BLOCK); i++)
                if (!chooseSite(compounds, false))
                    procedural++;
            for (int i = 0; i < amounts.get(Granularity.STATEMENT); i++)
                if (!chooseSite(compounds, true))
                    procedural++;

            List<BlockItem> items = transformCompoundStatement(function.body()).items();
            final var point = scopes.pointOf(original.get(0));
            for (int i = 0; i < procedural; i++)
                items = insert(point, original, items);

            final var body = new ArrayList<>(predicates.takeEntropicDeclarations());
            body.addAll(items);
            LOGGER.log(Level.DEBUG, "Guarded {0} site(s) and {1} time(s) the whole body of ''{2}''",
                sites.values().stream().mapToInt(List::size).sum(), procedural, function.name());
            return new FunctionDefinition(function.name(), function.type(), function.storage(),
                new CompoundStatement(body));
        }

        /**
         * Splits {@code number} into amounts per granularity proportional to their weights, handing out the remainder
         * randomly.
         */
        private Map<Granularity, Integer> distribute() {
            final var amounts = new EnumMap<Granularity, Integer>(Granularity.class);
            for (final var granularity : Granularity.values())
                amounts.put(granularity, 0);

            int totalWeight = 0;
            for (final var granularity : granularityOrder)
                totalWeight += weightOf(granularity);
            int distributed = 0;
            for (final var granularity : granularityOrder) {
                final var amount = number * weightOf(granularity) / totalWeight;
                amounts.put(granularity, amount);
                distributed += amount;
            }
            for (; distributed < number; distributed++)
                amounts.merge(granularityOrder.get(random.nextInt(granularityOrder.size())), 1, Integer::sum);
            return amounts;
        }

        private List<CompoundStatement> compoundsIn(final CompoundStatement body) {
            final var compounds = new ArrayList<CompoundStatement>();
            new TreeVisitor() {

                @Override
                public void visitCompoundStatement(final CompoundStatement compound) {
                    compounds.add(compound);
                    super.visitCompoundStatement(compound);
                }

                @Override
                public void visitExpression(final Expression expression) {
                }
            }.visitCompoundStatement(body);
            return compounds;
        }

        //region Choosing sites
        private boolean chooseSite(final List<CompoundStatement> compounds, final boolean single) {
            for (int attempt = 0; attempt < ATTEMPTS; attempt++) {
                final var compound = compounds.get(random.nextInt(compounds.size()));
                final var site = single ? randomStatement(compound.items()) : randomRun(compound.items());
                if (site == null)
                    continue;
                final var chosen = sites.computeIfAbsent(compound, key -> new ArrayList<>());
                if (chosen.stream().anyMatch(site::overlaps))
                    continue;
                chosen.add(site);
                return true;
            }
            return false;
        }

        private static boolean isGuardable(final BlockItem item) {
            return item instanceof Statement statement && !Trees.containsOpenSwitchLabel(statement);
        }

        private @Nullable Site randomStatement(final List<BlockItem> items) {
            final var candidates = new ArrayList<Integer>();
            for (int index = 0; index < items.size(); index++)
                if (isGuardable(items.get(index)))
                    candidates.add(index);
            if (candidates.isEmpty())
                return null;
            final var index = candidates.get(random.nextInt(candidates.size()));
            return new Site(index, index + 1);
        }

        private @Nullable Site randomRun(final List<BlockItem> items) {
            final var starts = new ArrayList<Integer>();
            for (int index = 0; index < items.size(); index++)
                if (isGuardable(items.get(index)))
                    starts.add(index);
            if (starts.isEmpty())
                return null;

            final int start = starts.get(random.nextInt(starts.size()));
            final var ends = new ArrayList<Integer>();
            for (int end = start + 1; end <= items.size(); end++) {
                final var last = items.get(end - 1);
                if (last instanceof Statement && !isGuardable(last))
                    break;
                if (containsDeclaration(items.subList(start, end)) && end != items.size())
                    continue;
                ends.add(end);
            }
            return new Site(start, ends.get(random.nextInt(ends.size())));
        }

        private static boolean containsDeclaration(final List<BlockItem> items) {
            return items.stream().anyMatch(item -> !(item instanceof Statement));
        }
        //endregion

        //region Inserting
        @Override
        public CompoundStatement transformCompoundStatement(final CompoundStatement compound) {
            final var chosen = sites.get(compound);
            if (chosen == null || chosen.isEmpty())
                return super.transformCompoundStatement(compound);

            final var original = compound.items();
            final var transformed = new ArrayList<List<BlockItem>>(original.size());
            for (final var item : original)
                transformed.add(transformBlockItem(item));

            final var items = new ArrayList<BlockItem>();
            int index = 0;
            for (final var site : chosen.stream().sorted(Comparator.comparingInt(Site::start)).toList()) {
                for (; index < site.start(); index++)
                    items.addAll(transformed.get(index));
                final var guarded = new ArrayList<BlockItem>();
                for (; index < site.end(); index++)
                    guarded.addAll(transformed.get(index));
                final var run = original.subList(site.start(), site.end());
                items.addAll(insert(scopes.pointOf(run.get(0)), run, guarded));
            }
            for (; index < original.size(); index++)
                items.addAll(transformed.get(index));
            return new CompoundStatement(items);
        }

        /**
         * Builds the construct guarding a run of items.
         *
         * @param point    The point of the first item of the run in the original tree.
         * @param original The items of the original tree, from which dead code is copied.
         * @param guarded  The transformed items.
         */
        private List<BlockItem> insert(final ProgramPoint point,
                                       final List<BlockItem> original,
                                       final List<BlockItem> guarded) {
            var kind = kindOrder.get(random.nextInt(kindOrder.size()));
            if (kind == PredicateKind.EITHER && declaresStatic(original))
                kind = PredicateKind.CHECK;

            final var predicate = switch (kind) {
                case CHECK, ELSE_TRUE -> predicates.alwaysTrue(point);
                case FALSE, ELSE_FALSE, WHILE_FALSE -> predicates.alwaysFalse(point);
                case EITHER -> predicates.either(point);
            };
            if (predicate == null)
                return guarded;

            final var code = new CompoundStatement(guarded);
            return switch (kind) {
                case CHECK -> List.of(new IfStatement(predicate, code, null));
                case FALSE -> prepend(new IfStatement(predicate, buggy(original), null), guarded);
                case ELSE_TRUE  -> List.of(new IfStatement(predicate, code, buggy(original)));
                case ELSE_FALSE -> List.of(new IfStatement(predicate, buggy(original), code));
                case WHILE_FALSE -> prepend(new WhileStatement(predicate, buggy(original)), guarded);
                case EITHER -> List.of(new IfStatement(predicate, code, new CompoundStatement(bugs.copy(original))));
            };
        }

        private CompoundStatement buggy(final List<BlockItem> original) {
            return new CompoundStatement(bugs.mutatedCopy(original));
        }

        private static List<BlockItem> prepend(final Statement first, final List<BlockItem> rest) {
            final var items = new ArrayList<BlockItem>(rest.size() + 1);
            items.add(first);
            items.addAll(rest);
            return items;
        }

        /**
         * Decides whether the items declare a {@code static} local variable, whose copy would be a distinct object.
         */
        private static boolean declaresStatic(final List<BlockItem> items) {
            final var found = new boolean[1];
            final var visitor = new TreeVisitor() {

                @Override
                public void visitDeclaration(final Declaration declaration) {
                    found[0] |= declaration.storage() == StorageClass.STATIC;
                    super.visitDeclaration(declaration);
                }
            };
            for (final var item : items)
                visitor.visitBlockItem(item);
            return found[0];
        }
        //endregion
    }
}
