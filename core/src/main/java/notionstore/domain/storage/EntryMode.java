package notionstore.domain.storage;

public enum EntryMode {
    FILE,
    DIR
}
