package io.clusterautoscaler.cloudprovider;

import io.clusterautoscaler.cloudprovider.errors.ConstructionException;
import io.clusterautoscaler.cloudprovider.errors.ErrorKind;
import io.clusterautoscaler.cloudprovider.etcd.EtcdCloudProvider;
import io.etcd.jetcd.Client;
import io.etcd.jetcd.ClientBuilder;
import io.etcd.jetcd.KV;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.MockedStatic;
import org.mockito.Mockito;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.when;

/**
 * Tests for CloudProviderBuilder. The etcd client is mocked, so no server is needed.
 */
public class CloudProviderBuilderTest {

    private MockedStatic<Client> clientStaticMock;
    private ResourceLimiter resourceLimiter;
    private AutoscalingOptions options;

    @BeforeEach
    public void setUp() {
        clientStaticMock = Mockito.mockStatic(Client.class);
        ClientBuilder mockBuilder = mock(ClientBuilder.class);
        clientStaticMock.when(Client::builder).thenReturn(mockBuilder);
        when(mockBuilder.endpoints(any(String[].class))).thenReturn(mockBuilder);

        Client mockEtcdClient = mock(Client.class);
        when(mockEtcdClient.getKVClient()).thenReturn(mock(KV.class));
        when(mockBuilder.build()).thenReturn(mockEtcdClient);

        resourceLimiter = new ResourceLimiter(Map.of("cpu", 2L), Map.of("cpu", 32L));
        options = AutoscalingOptions.builder()
                .cloudProviderName("etcd")
                .clusterName("test-cluster")
                .etcdEndpoint("http://localhost:2379")
                .gpuType("nvidia-a100")
                .build();
    }

    @AfterEach
    public void tearDown() {
        if (clientStaticMock != null) clientStaticMock.close();
    }

    @Test
    public void testBuild_EtcdProvider() throws Exception {
        CloudProvider provider = CloudProviderBuilder.build(
                options, new NodeGroupDiscoveryOptions(List.of("1:5:pool-a")), resourceLimiter);

        assertThat(provider).isInstanceOf(EtcdCloudProvider.class);
        assertThat(provider.name()).isEqualTo("etcd");
        assertThat(provider.getResourceLimiter()).isSameAs(resourceLimiter);
        assertThat(provider.getAvailableGpuTypes()).containsExactly("nvidia-a100");
        assertThat(provider.generation()).isZero();
        assertThat(provider.nodeGroups()).isEmpty();
    }

    @Test
    public void testBuild_NullDiscoveryMeansAutoDiscovery() throws Exception {
        assertThat(CloudProviderBuilder.build(options, null, resourceLimiter)).isNotNull();
    }

    @Test
    public void testBuild_UnknownProvider() {
        AutoscalingOptions unknown = AutoscalingOptions.builder()
                .cloudProviderName("rancher")
                .etcdEndpoint("http://localhost:2379")
                .build();

        assertThatThrownBy(() -> CloudProviderBuilder.build(unknown, NodeGroupDiscoveryOptions.autoDiscovery(), resourceLimiter))
                .isInstanceOf(ConstructionException.class)
                .hasMessage("Unknown cloud provider 'rancher', available providers: [etcd]")
                .isInstanceOfSatisfying(ConstructionException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.CONSTRUCTION));
        clientStaticMock.verify(Client::builder, never());
    }

    @Test
    public void testBuild_MissingResourceLimiter() {
        assertThatThrownBy(() -> CloudProviderBuilder.build(options, NodeGroupDiscoveryOptions.autoDiscovery(), null))
                .isInstanceOf(ConstructionException.class)
                .hasMessage("Resource limiter must be provided");
    }

    @Test
    public void testBuild_MissingOptions() {
        assertThatThrownBy(() -> CloudProviderBuilder.build(null, NodeGroupDiscoveryOptions.autoDiscovery(), resourceLimiter))
                .isInstanceOf(ConstructionException.class);
    }

    @Test
    public void testBuild_InvalidNodeGroupSpec() {
        NodeGroupDiscoveryOptions invalid = new NodeGroupDiscoveryOptions(List.of("5:1:pool-a"));

        assertThatThrownBy(() -> CloudProviderBuilder.build(options, invalid, resourceLimiter))
                .isInstanceOf(ConstructionException.class)
                .hasMessageStartingWith("Invalid node group discovery options")
                .hasCauseInstanceOf(IllegalArgumentException.class);
        clientStaticMock.verify(Client::builder, never());
    }

    @Test
    public void testAvailableProviders() {
        assertThat(CloudProviderBuilder.availableProviders()).containsExactly("etcd");
    }
}
