package notionstore.domain.storage;

public record AccessorInfo(String scheme, String root, Capability capability) {
}
