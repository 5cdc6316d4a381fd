package jobhub.backend.storage;

public enum SignedUrlMode {
    GET,
    PUT
}
