package co.fanki.reposync.repository.domain;

/**
 * Transport a repository prefers to be cloned over.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum Protocol {

    /** Smart HTTP(S), authenticated with tokens. */
    HTTPS,

    /** SSH, authenticated with a key pair. */
    SSH;

}
