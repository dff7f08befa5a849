package com.rms.cdc.jetstream.bootstrap;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import com.rms.cdc.jetstream.config.DeliveryProperties;

import io.nats.client.JetStreamApiException;
import io.nats.client.KeyValueManagement;
import io.nats.client.api.KeyValueConfiguration;
import io.nats.client.api.KeyValueStatus;
import io.nats.client.api.StorageType;

@ExtendWith(MockitoExtension.class)
class KeyValueBootstrapperTest {

    @Mock
    private KeyValueManagement kvm;

    private DeliveryProperties props;

    private KeyValueBootstrapper bootstrapper;

    @BeforeEach
    void setUp() {
        props = new DeliveryProperties();
        props.setMode(DeliveryProperties.Mode.KEYED);
        props.getKeyed().setStreamId("CDC_ROWS");
        props.getKeyed().setHistory(1);
        bootstrapper = new KeyValueBootstrapper(kvm, props);
    }

    private static JetStreamApiException apiError(int code) {
        JetStreamApiException e = mock(JetStreamApiException.class);
        when(e.getApiErrorCode()).thenReturn(code);
        return e;
    }

    private static KeyValueStatus status(long history) {
        KeyValueStatus status = mock(KeyValueStatus.class);
        when(status.getMaxHistoryPerKey()).thenReturn(history);
        when(status.getStorageType()).thenReturn(StorageType.File);
        return status;
    }

    @Test
    void createsMissingBucket() throws Exception {
        JetStreamApiException notFound = apiError(KeyValueBootstrapper.JS_STREAM_NOT_FOUND_ERR);
        when(kvm.getStatus("CDC_ROWS")).thenThrow(notFound);

        bootstrapper.run(null);

        ArgumentCaptor<KeyValueConfiguration> config = ArgumentCaptor.forClass(KeyValueConfiguration.class);
        verify(kvm).create(config.capture());
        assertThat(config.getValue().getBucketName()).isEqualTo("CDC_ROWS");
        assertThat(config.getValue().getMaxHistoryPerKey()).isEqualTo(1);
        assertThat(config.getValue().getStorageType()).isEqualTo(StorageType.File);
    }

    @Test
    void keepsMatchingBucket() throws Exception {
        KeyValueStatus existing = status(1);
        when(kvm.getStatus("CDC_ROWS")).thenReturn(existing);

        bootstrapper.run(null);

        verify(kvm, never()).create(any());
    }

    @Test
    void mismatchFailsStartupWhenStrict() throws Exception {
        props.getKeyed().setFailOnMismatch(true);
        KeyValueStatus existing = status(5);
        when(kvm.getStatus("CDC_ROWS")).thenReturn(existing);

        assertThatThrownBy(() -> bootstrapper.run(null))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("history actual=5 expected=1");
    }

    @Test
    void mismatchOnlyWarnsByDefault() throws Exception {
        KeyValueStatus existing = status(5);
        when(kvm.getStatus("CDC_ROWS")).thenReturn(existing);

        bootstrapper.run(null);

        verify(kvm, never()).create(any());
    }

    @Test
    void otherApiErrorsAreNotMaskedAsMissingBucket() throws Exception {
        JetStreamApiException denied = apiError(10100);
        when(kvm.getStatus("CDC_ROWS")).thenThrow(denied);

        assertThatThrownBy(() -> bootstrapper.run(null)).isSameAs(denied);
        verify(kvm, never()).create(any());
    }

    @Test
    void disabledBootstrapDoesNothing() throws Exception {
        props.getKeyed().setBootstrap(false);

        bootstrapper.run(null);

        verifyNoInteractions(kvm);
    }
}
