package jobhub.backend.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Credentials used on the compute side to clone a private repository.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record RemoteRepoCredentials(
        Protocol protocol,
        String privateKey,
        String oauthToken) {

    public enum Protocol {
        HTTPS,
        SSH
    }

    @Override
    public String toString() {
        return "RemoteRepoCredentials{protocol=" + protocol + "}";
    }
}
