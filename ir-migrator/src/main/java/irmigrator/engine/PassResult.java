package irmigrator.engine;

/**
 * Node counts of one rule applicator pass.
 *
 * @param visited number of indices visited (table length at pass start)
 * @param rewritten number of visited nodes that had a rule chain
 * @param appended number of nodes appended during the pass
 * @param tombstoned number of nodes tombstoned during the pass
 */
public record PassResult(int visited, int rewritten, int appended, int tombstoned) {
}
