package com.minibrowser.proxy.core.upstream;

import com.minibrowser.proxy.core.exceptions.TargetNotAllowedException;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.URI;
import java.net.UnknownHostException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TargetGuardTest {

    private static TargetGuard resolvingTo(String address) {
        return new TargetGuard(true, host -> new InetAddress[] { InetAddress.getByName(address) });
    }

    @Test
    void disabledGuardAllowsEverything() {
        TargetGuard guard = new TargetGuard(false);

        assertThat(guard.isEnabled()).isFalse();
        assertThatCode(() -> guard.check(URI.create("http://127.0.0.1:8080/"))).doesNotThrowAnyException();
        assertThatCode(() -> guard.check(URI.create("http://localhost/"))).doesNotThrowAnyException();
    }

    @Test
    void blocksLocalhostNames() {
        TargetGuard guard = resolvingTo("93.184.216.34");

        assertThatThrownBy(() -> guard.check(URI.create("http://localhost/")))
                .isInstanceOf(TargetNotAllowedException.class);
        assertThatThrownBy(() -> guard.check(URI.create("http://app.localhost/")))
                .isInstanceOf(TargetNotAllowedException.class);
    }

    @Test
    void blocksHostsResolvingToPrivateAddresses() {
        assertThatThrownBy(() -> resolvingTo("10.0.0.5").check(URI.create("https://intranet.example.com/")))
                .isInstanceOf(TargetNotAllowedException.class)
                .hasMessageContaining("intranet.example.com");
        assertThatThrownBy(() -> resolvingTo("169.254.169.254").check(URI.create("http://meta.example.com/")))
                .isInstanceOf(TargetNotAllowedException.class);
    }

    @Test
    void allowsPublicAddresses() {
        assertThatCode(() -> resolvingTo("93.184.216.34").check(URI.create("https://example.com/")))
                .doesNotThrowAnyException();
    }

    @Test
    void checksRegistryBasedHosts() {
        assertThatThrownBy(() -> resolvingTo("192.168.0.7").check(URI.create("https://my_nas.example.com/")))
                .isInstanceOf(TargetNotAllowedException.class);
        assertThatCode(() -> resolvingTo("93.184.216.34").check(URI.create("https://my_site.example.com/")))
                .doesNotThrowAnyException();
    }

    @Test
    void unresolvableHostIsLeftToTheFetch() {
        TargetGuard guard = new TargetGuard(true, host -> {
            throw new UnknownHostException(host);
        });

        assertThatCode(() -> guard.check(URI.create("https://no-such-host.invalid/")))
                .doesNotThrowAnyException();
    }

    @Test
    void isInternal() throws UnknownHostException {
        assertThat(TargetGuard.isInternal(InetAddress.getByName("127.0.0.1"))).isTrue();
        assertThat(TargetGuard.isInternal(InetAddress.getByName("192.168.1.10"))).isTrue();
        assertThat(TargetGuard.isInternal(InetAddress.getByName("100.64.0.1"))).isTrue();
        assertThat(TargetGuard.isInternal(InetAddress.getByName("::1"))).isTrue();
        assertThat(TargetGuard.isInternal(InetAddress.getByName("fd00::1"))).isTrue();
        assertThat(TargetGuard.isInternal(InetAddress.getByName("0.0.0.0"))).isTrue();
        assertThat(TargetGuard.isInternal(InetAddress.getByName("8.8.8.8"))).isFalse();
        assertThat(TargetGuard.isInternal(InetAddress.getByName("2606:4700::1111"))).isFalse();
    }
}
