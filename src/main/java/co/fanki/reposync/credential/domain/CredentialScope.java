package co.fanki.reposync.credential.domain;

/**
 * What a credential is allowed to do on the remote.
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public enum CredentialScope {

    READ_ONLY,

    READ_WRITE;

}
