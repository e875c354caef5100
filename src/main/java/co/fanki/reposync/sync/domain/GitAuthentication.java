package co.fanki.reposync.sync.domain;

import co.fanki.reposync.credential.domain.CredentialHandle;
import co.fanki.reposync.credential.domain.CredentialMethod;
import org.apache.sshd.common.NamedResource;
import org.apache.sshd.common.util.security.SecurityUtils;
import org.eclipse.jgit.api.TransportCommand;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.SshTransport;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.eclipse.jgit.transport.sshd.SshdSessionFactory;
import org.eclipse.jgit.transport.sshd.SshdSessionFactoryBuilder;
import org.eclipse.jgit.util.FS;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;

/**
 * Turns credential handles into JGit transport configuration.
 *
 * <p>Token methods authenticate over HTTPS basic auth with the
 * {@code x-access-token} user, which GitHub accepts for personal,
 * fine-grained, collaborator and app installation tokens alike. Deploy
 * keys are parsed in memory and offered by a dedicated SSH session
 * factory; they are never written to disk.</p>
 *
 * @author waabox(emiliano[at]fanki[dot]co)
 */
public class GitAuthentication {

    /** User name sent along with tokens. */
    static final String TOKEN_USER = "x-access-token";

    /**
     * Prepares the transport settings for one git operation.
     *
     * @param credential the credential to authenticate with
     * @return a session that must be closed when the operation ends
     * @throws AuthException if a deploy key cannot be parsed
     */
    public Session open(final CredentialHandle credential) {
        final CredentialMethod method = credential.method();
        if (method == CredentialMethod.ANONYMOUS) {
            return new Session(null, null);
        }
        if (method == CredentialMethod.DEPLOY_KEY) {
            return new Session(null, sshFactoryFor(credential));
        }
        return new Session(new UsernamePasswordCredentialsProvider(
                TOKEN_USER, credential.secret()), null);
    }

    private SshdSessionFactory sshFactoryFor(final CredentialHandle credential) {
        final Iterable<KeyPair> keys = loadKeys(credential);
        final File home = FS.DETECTED.userHome();
        return new SshdSessionFactoryBuilder()
                .setHomeDirectory(home)
                .setSshDirectory(new File(home, ".ssh"))
                .setDefaultKeysProvider(sshDirectory -> keys)
                .build(null);
    }

    private Iterable<KeyPair> loadKeys(final CredentialHandle credential) {
        final byte[] pem = credential.secret().getBytes(StandardCharsets.UTF_8);
        try (InputStream in = new ByteArrayInputStream(pem)) {
            final Iterable<KeyPair> keys = SecurityUtils.loadKeyPairIdentities(
                    null, NamedResource.ofName("deploy-key"), in, null);
            if (keys == null || !keys.iterator().hasNext()) {
                throw new AuthException("Deploy key contains no key pair", null);
            }
            return keys;
        } catch (final IOException | GeneralSecurityException e) {
            throw new AuthException("Deploy key cannot be parsed", e);
        }
    }

    /**
     * Transport settings bound to a single git operation.
     */
    public static final class Session implements AutoCloseable {

        private final CredentialsProvider credentialsProvider;
        private final SshdSessionFactory sshSessionFactory;

        private Session(final CredentialsProvider theCredentialsProvider,
                final SshdSessionFactory theSshSessionFactory) {
            this.credentialsProvider = theCredentialsProvider;
            this.sshSessionFactory = theSshSessionFactory;
        }

        /**
         * Applies the credential to a clone, fetch or ls-remote command.
         *
         * @param command the command to configure
         */
        public void configure(final TransportCommand<?, ?> command) {
            if (credentialsProvider != null) {
                command.setCredentialsProvider(credentialsProvider);
            }
            if (sshSessionFactory != null) {
                command.setTransportConfigCallback(transport -> {
                    if (transport instanceof SshTransport) {
                        ((SshTransport) transport).setSshSessionFactory(
                                sshSessionFactory);
                    }
                });
            }
        }

        @Override
        public void close() {
            if (sshSessionFactory != null) {
                sshSessionFactory.close();
            }
        }

    }

}
