package co.fanki.reposync.repository.domain;

import co.fanki.reposync.shared.Preconditions;
import co.fanki.reposync.shared.ValueObject;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable identifier of a hosted git repository.
 *
 * <p>Two references are equal when host, owner and name match. The
 * preferred protocol only changes how the repository is reached, not
 * which repository it is, so it does not take part in equality.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public final class RepositoryRef implements ValueObject {

    private static final long serialVersionUID = 1L;

    /** Host used when a reference is created without one. */
    public static final String DEFAULT_HOST = "github.com";

    private static final Pattern SEGMENT = Pattern.compile("^[\\w.-]+$");

    private static final Pattern HTTPS_PATTERN = Pattern.compile(
            "^https://([\\w.-]+(?::\\d+)?)/([\\w.-]+)/([\\w.-]+?)(?:\\.git)?/?$");
    private static final Pattern SCP_SSH_PATTERN = Pattern.compile(
            "^git@([\\w.-]+):([\\w.-]+)/([\\w.-]+?)(?:\\.git)?$");
    private static final Pattern URL_SSH_PATTERN = Pattern.compile(
            "^ssh://git@([\\w.-]+(?::\\d+)?)/([\\w.-]+)/([\\w.-]+?)(?:\\.git)?/?$");

    private final String host;
    private final String owner;
    private final String name;
    private final Protocol protocol;

    private RepositoryRef(final String theHost, final String theOwner,
            final String theName, final Protocol theProtocol) {
        Preconditions.requireNonBlank(theHost, "Repository host is required");
        Preconditions.requireNonBlank(theOwner, "Repository owner is required");
        Preconditions.requireNonBlank(theName, "Repository name is required");
        Preconditions.require(SEGMENT.matcher(theOwner).matches(),
                "Invalid repository owner: " + theOwner);
        Preconditions.require(SEGMENT.matcher(theName).matches(),
                "Invalid repository name: " + theName);
        Preconditions.require(!theName.equals(".") && !theName.equals(".."),
                "Invalid repository name: " + theName);
        this.host = theHost.toLowerCase(Locale.ROOT);
        this.owner = theOwner;
        this.name = theName;
        this.protocol = Preconditions.requireNonNull(theProtocol,
                "Repository protocol is required");
    }

    /**
     * Creates a reference reached over HTTPS.
     *
     * @param host the git host, e.g. {@code github.com}
     * @param owner the owning user or organization
     * @param name the repository name
     * @return the reference
     */
    public static RepositoryRef of(final String host, final String owner,
            final String name) {
        return new RepositoryRef(host, owner, name, Protocol.HTTPS);
    }

    /**
     * Creates a reference with an explicit protocol.
     *
     * @param host the git host
     * @param owner the owning user or organization
     * @param name the repository name
     * @param protocol the preferred transport
     * @return the reference
     */
    public static RepositoryRef of(final String host, final String owner,
            final String name, final Protocol protocol) {
        return new RepositoryRef(host, owner, name, protocol);
    }

    /**
     * Parses a clone URL.
     *
     * <p>Accepts {@code https://host/owner/name(.git)},
     * {@code git@host:owner/name(.git)} and
     * {@code ssh://git@host/owner/name(.git)}. The protocol of the
     * reference follows the URL scheme.</p>
     *
     * @param url the clone URL
     * @return the reference
     * @throws IllegalArgumentException if the URL is not recognized
     */
    public static RepositoryRef parse(final String url) {
        Preconditions.requireNonBlank(url, "Repository URL cannot be blank");
        final String trimmed = url.trim();

        Matcher matcher = HTTPS_PATTERN.matcher(trimmed);
        if (matcher.matches()) {
            return new RepositoryRef(matcher.group(1), matcher.group(2),
                    matcher.group(3), Protocol.HTTPS);
        }
        matcher = SCP_SSH_PATTERN.matcher(trimmed);
        if (matcher.matches()) {
            return new RepositoryRef(matcher.group(1), matcher.group(2),
                    matcher.group(3), Protocol.SSH);
        }
        matcher = URL_SSH_PATTERN.matcher(trimmed);
        if (matcher.matches()) {
            return new RepositoryRef(matcher.group(1), matcher.group(2),
                    matcher.group(3), Protocol.SSH);
        }
        throw new IllegalArgumentException(
                "Invalid repository URL format: " + url);
    }

    /**
     * Parses a clone URL or an identifier.
     *
     * <p>Besides the forms {@link #parse} accepts, takes
     * {@code host/owner/name} and {@code owner/name}, the latter on
     * {@link #DEFAULT_HOST}.</p>
     *
     * @param value the URL or identifier
     * @return the reference
     * @throws IllegalArgumentException if the value is not recognized
     */
    public static RepositoryRef parseIdentifier(final String value) {
        Preconditions.requireNonBlank(value, "Repository cannot be blank");
        final String trimmed = value.trim();
        if (trimmed.contains("://") || trimmed.startsWith("git@")) {
            return parse(trimmed);
        }
        final String[] parts = trimmed.split("/");
        if (parts.length == 2) {
            return of(DEFAULT_HOST, parts[0], parts[1]);
        }
        if (parts.length == 3) {
            return of(parts[0], parts[1], parts[2]);
        }
        throw new IllegalArgumentException(
                "Invalid repository identifier: " + value);
    }

    /**
     * Returns the same repository reached over another protocol.
     *
     * @param theProtocol the protocol to use
     * @return a reference equal to this one
     */
    public RepositoryRef withProtocol(final Protocol theProtocol) {
        if (protocol == theProtocol) {
            return this;
        }
        return new RepositoryRef(host, owner, name, theProtocol);
    }

    /**
     * Renders the clone URL for the preferred protocol.
     *
     * @return the clone URL
     */
    public String cloneUrl() {
        if (protocol == Protocol.SSH) {
            return "git@" + host + ":" + owner + "/" + name + ".git";
        }
        return "https://" + host + "/" + owner + "/" + name + ".git";
    }

    /**
     * Canonical identifier used in reports, logs and storage.
     *
     * @return {@code host/owner/name}
     */
    public String identifier() {
        return host + "/" + owner + "/" + name;
    }

    /**
     * Name of the directory that holds this repository's checkout.
     *
     * @return {@code owner_name}
     */
    public String workspaceDirectoryName() {
        return owner + "_" + name;
    }

    public String host() {
        return host;
    }

    public String owner() {
        return owner;
    }

    public String name() {
        return name;
    }

    public Protocol protocol() {
        return protocol;
    }

    @Override
    public boolean equals(final Object obj) {
        if (this == obj) {
            return true;
        }
        if (obj == null || getClass() != obj.getClass()) {
            return false;
        }
        final RepositoryRef that = (RepositoryRef) obj;
        return owner.equals(that.owner)
                && name.equals(that.name)
                && host.equals(that.host);
    }

    @Override
    public int hashCode() {
        return Objects.hash(owner, name, host);
    }

    @Override
    public String toString() {
        return identifier();
    }

}
