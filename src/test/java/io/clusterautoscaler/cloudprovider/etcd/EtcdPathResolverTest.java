package io.clusterautoscaler.cloudprovider.etcd;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EtcdPathResolverTest {

    private final EtcdPathResolver pathResolver = EtcdPathResolver.getInstance();

    @Test
    void testGetInstance_ReturnsSingleton() {
        assertThat(EtcdPathResolver.getInstance()).isSameAs(pathResolver);
    }

    @Test
    void testNodePoolPaths() {
        assertThat(pathResolver.getNodePoolsPrefix("c1")).isEqualTo("/c1/node-pools");
        assertThat(pathResolver.getNodePoolConfPath("c1", "pool-a")).isEqualTo("/c1/node-pools/pool-a/conf");
        assertThat(pathResolver.getNodePoolGoalStatePath("c1", "pool-a")).isEqualTo("/c1/node-pools/pool-a/goal-state");
    }

    @Test
    void testNodePaths() {
        assertThat(pathResolver.getNodesPrefix("c1")).isEqualTo("/c1/nodes");
    }

    @Test
    void testExtractNodePoolId() {
        assertThat(pathResolver.extractNodePoolId("c1", "/c1/node-pools/pool-a/conf")).isEqualTo("pool-a");
        assertThat(pathResolver.extractNodePoolId("c1", "/c1/node-pools/pool-a")).isNull();
        assertThat(pathResolver.extractNodePoolId("c1", "/c2/node-pools/pool-a/conf")).isNull();
        assertThat(pathResolver.extractNodePoolId("c1", null)).isNull();
    }
}
