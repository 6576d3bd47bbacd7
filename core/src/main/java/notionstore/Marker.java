package notionstore;

/**
 * Exists so Weld can scan the notionstore package tree from a shared ancestor package.
 */
public final class Marker {
    private Marker() {
    }
}
