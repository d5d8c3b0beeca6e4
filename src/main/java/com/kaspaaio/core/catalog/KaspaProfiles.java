package com.kaspaaio.core.catalog;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The eight profiles shipped with Kaspa All-in-One.
 */
public final class KaspaProfiles {

    public static final String KASPA_NODE = "kaspa-node";
    public static final String KASIA_APP = "kasia-app";
    public static final String K_SOCIAL_APP = "k-social-app";
    public static final String KASPA_EXPLORER_BUNDLE = "kaspa-explorer-bundle";
    public static final String KASIA_INDEXER = "kasia-indexer";
    public static final String K_INDEXER_BUNDLE = "k-indexer-bundle";
    public static final String KASPA_ARCHIVE_NODE = "kaspa-archive-node";
    public static final String KASPA_STRATUM = "kaspa-stratum";

    private static final String RUSTY_KASPAD = "kaspanet/rusty-kaspad:latest";
    private static final String TIMESCALEDB = "timescale/timescaledb:latest-pg16";

    private static final List<String> NETWORKS = List.of("mainnet", "testnet-10", "testnet-11");
    private static final List<String> NODE_MODES = List.of("local", "remote");
    private static final List<String> INDEXER_MODES = List.of("auto", "local", "public");

    private KaspaProfiles() {}

    /** Keys that apply regardless of the selected profiles. */
    public static List<SettingField> globalFields() {
        return List.of(
                new SettingField("KASPA_NETWORK", SettingType.ENUM, true, NETWORKS, "Kaspa network to join"),
                SettingField.of("KASPA_DATA_DIR", SettingType.PATH, "Host directory for service data"),
                SettingField.of("EXTERNAL_IP", SettingType.STRING, "Public IP advertised by the node"),
                SettingField.of("REMOTE_KASPA_NODE_WRPC_URL", SettingType.URL,
                        "wRPC endpoint used by indexers when no local node is installed")
        );
    }

    public static Map<String, String> globalDefaults() {
        var defaults = new LinkedHashMap<String, String>();
        defaults.put("KASPA_NETWORK", "mainnet");
        defaults.put("KASPA_DATA_DIR", "./data");
        return defaults;
    }

    public static List<Profile> all() {
        return List.of(kaspaNode(), kasiaApp(), kSocialApp(), explorerBundle(), kasiaIndexer(),
                kIndexerBundle(), archiveNode(), stratum());
    }

    private static Profile kaspaNode() {
        return nodeProfile(KASPA_NODE, "Kaspa Node", "Rusty Kaspa full node with UTXO index",
                KASPA_ARCHIVE_NODE, new ResourceRequirements(2, 4, 100, 4, 8, 500));
    }

    private static Profile archiveNode() {
        return nodeProfile(KASPA_ARCHIVE_NODE, "Kaspa Archive Node", "Full node that keeps the complete history",
                KASPA_NODE, new ResourceRequirements(8, 16, 1000, 16, 32, 5000));
    }

    private static Profile nodeProfile(String id, String name, String description, String conflict,
                                       ResourceRequirements resources) {
        var env = new LinkedHashMap<String, String>();
        env.put("KASPA_NETWORK", "KASPA_NETWORK");
        env.put("PUBLIC_NODE", "PUBLIC_NODE");
        env.put("UTXO_INDEX", "UTXO_INDEX");
        env.put("EXTERNAL_IP", "EXTERNAL_IP");
        var ports = new LinkedHashMap<String, Integer>();
        ports.put("KASPA_NODE_RPC_PORT", 16110);
        ports.put("KASPA_NODE_P2P_PORT", 16111);
        ports.put("KASPA_NODE_WRPC_PORT", 17110);

        return Profile.builder(id, name)
                .description(description)
                .service(new ServiceRef(id, Set.of(id), 1, RUSTY_KASPAD, null, ports, env,
                        List.of("${KASPA_DATA_DIR}/" + id + ":/app/data")))
                .conflicts(conflict)
                .ports(16110, 16111, 17110)
                .resources(resources)
                .requiredSettings("KASPA_NETWORK")
                .defaultSetting("KASPA_NODE_RPC_PORT", "16110")
                .defaultSetting("KASPA_NODE_P2P_PORT", "16111")
                .defaultSetting("KASPA_NODE_WRPC_PORT", "17110")
                .defaultSetting("PUBLIC_NODE", "false")
                .defaultSetting("UTXO_INDEX", "true")
                .field(SettingField.of("KASPA_NODE_RPC_PORT", SettingType.PORT, "gRPC port"))
                .field(SettingField.of("KASPA_NODE_P2P_PORT", SettingType.PORT, "P2P port"))
                .field(SettingField.of("KASPA_NODE_WRPC_PORT", SettingType.PORT, "Borsh wRPC port"))
                .field(SettingField.of("PUBLIC_NODE", SettingType.BOOLEAN, "Accept inbound peers"))
                .field(SettingField.of("UTXO_INDEX", SettingType.BOOLEAN, "Maintain the UTXO index"))
                .build();
    }

    private static Profile kasiaApp() {
        return Profile.builder(KASIA_APP, "Kasia Messaging App")
                .description("Encrypted messaging web app")
                .service(new ServiceRef("kasia-app", Set.of(KASIA_APP), 4, null,
                        BuildSpec.of("./services/kasia"),
                        Map.of("KASIA_APP_PORT", 3000),
                        orderedEnv("KASPA_NETWORK", "KASPA_NETWORK",
                                "KASIA_INDEXER_MODE", "KASIA_INDEXER_MODE",
                                "REMOTE_KASIA_INDEXER_URL", "REMOTE_KASIA_INDEXER_URL"),
                        List.of()))
                .ports(3001)
                .resources(ResourceRequirements.of(1, 1, 1))
                .defaultSetting("KASIA_APP_PORT", "3001")
                .defaultSetting("KASIA_INDEXER_MODE", "auto")
                .field(SettingField.of("KASIA_APP_PORT", SettingType.PORT, "Web UI port"))
                .field(SettingField.choice("KASIA_INDEXER_MODE", INDEXER_MODES, "Which Kasia indexer the app uses"))
                .field(SettingField.of("REMOTE_KASIA_INDEXER_URL", SettingType.URL, "Public Kasia indexer URL"))
                .build();
    }

    private static Profile kSocialApp() {
        return Profile.builder(K_SOCIAL_APP, "K-Social App")
                .description("Decentralized social network web app")
                .service(new ServiceRef("k-social", Set.of(K_SOCIAL_APP), 4, null,
                        BuildSpec.of("./services/k-social"),
                        Map.of("KSOCIAL_APP_PORT", 3000),
                        orderedEnv("KASPA_NETWORK", "KASPA_NETWORK",
                                "KSOCIAL_INDEXER_MODE", "KSOCIAL_INDEXER_MODE",
                                "REMOTE_KSOCIAL_INDEXER_URL", "REMOTE_KSOCIAL_INDEXER_URL"),
                        List.of()))
                .ports(3003)
                .resources(ResourceRequirements.of(1, 1, 1))
                .defaultSetting("KSOCIAL_APP_PORT", "3003")
                .defaultSetting("KSOCIAL_INDEXER_MODE", "auto")
                .field(SettingField.of("KSOCIAL_APP_PORT", SettingType.PORT, "Web UI port"))
                .field(SettingField.choice("KSOCIAL_INDEXER_MODE", INDEXER_MODES, "Which K indexer the app uses"))
                .field(SettingField.of("REMOTE_KSOCIAL_INDEXER_URL", SettingType.URL, "Public K indexer URL"))
                .build();
    }

    private static Profile explorerBundle() {
        String owner = KASPA_EXPLORER_BUNDLE;
        return Profile.builder(owner, "Kaspa Explorer")
                .description("Block explorer with the Simply Kaspa indexer and TimescaleDB")
                .service(new ServiceRef("timescaledb-explorer", Set.of(owner), 2, TIMESCALEDB, null,
                        Map.of("TIMESCALEDB_EXPLORER_PORT", 5432),
                        postgresEnv("EXPLORER"),
                        List.of("${KASPA_DATA_DIR}/timescaledb-explorer:/var/lib/postgresql/data")))
                .service(new ServiceRef("simply-kaspa-indexer", Set.of(owner), 3,
                        "supertypo/simply-kaspa-indexer:latest", null,
                        Map.of("SIMPLY_KASPA_INDEXER_PORT", 8000),
                        indexerEnv("SIMPLY_KASPA_NODE_MODE", "EXPLORER"),
                        List.of()))
                .service(new ServiceRef("kaspa-explorer", Set.of(owner), 4, null,
                        BuildSpec.of("./services/kaspa-explorer"),
                        Map.of("KASPA_EXPLORER_PORT", 80),
                        orderedEnv("KASPA_NETWORK", "KASPA_NETWORK"),
                        List.of()))
                .recommends(KASPA_NODE, KASPA_ARCHIVE_NODE)
                .ports(3004, 3005, 5434)
                .resources(ResourceRequirements.of(2, 4, 200))
                .defaultSetting("KASPA_EXPLORER_PORT", "3004")
                .defaultSetting("SIMPLY_KASPA_INDEXER_PORT", "3005")
                .defaultSetting("TIMESCALEDB_EXPLORER_PORT", "5434")
                .defaultSetting("SIMPLY_KASPA_NODE_MODE", "local")
                .defaultSetting("POSTGRES_USER_EXPLORER", "kaspa_explorer")
                .defaultSetting("POSTGRES_DB_EXPLORER", "simply_kaspa")
                .field(SettingField.of("KASPA_EXPLORER_PORT", SettingType.PORT, "Explorer web port"))
                .field(SettingField.of("SIMPLY_KASPA_INDEXER_PORT", SettingType.PORT, "Indexer API port"))
                .field(SettingField.of("TIMESCALEDB_EXPLORER_PORT", SettingType.PORT, "Explorer database port"))
                .field(SettingField.choice("SIMPLY_KASPA_NODE_MODE", NODE_MODES, "Node the indexer reads from"))
                .field(SettingField.of("POSTGRES_USER_EXPLORER", SettingType.STRING, "Explorer database user"))
                .field(SettingField.of("POSTGRES_DB_EXPLORER", SettingType.STRING, "Explorer database name"))
                .field(new SettingField("POSTGRES_PASSWORD_EXPLORER", SettingType.SECRET, true, List.of(),
                        "Explorer database password"))
                .build();
    }

    private static Profile kasiaIndexer() {
        return Profile.builder(KASIA_INDEXER, "Kasia Indexer")
                .description("Indexer backing the Kasia messaging app")
                .service(new ServiceRef("kasia-indexer", Set.of(KASIA_INDEXER), 3, "kkluster/kasia-indexer:main", null,
                        Map.of("KASIA_INDEXER_PORT", 8080),
                        orderedEnv("KASPA_NETWORK", "KASPA_NETWORK",
                                "NODE_MODE", "KASIA_NODE_MODE",
                                "REMOTE_KASPA_NODE_WRPC_URL", "REMOTE_KASPA_NODE_WRPC_URL"),
                        List.of("${KASPA_DATA_DIR}/kasia-indexer:/app/data")))
                .recommends(KASPA_NODE, KASPA_ARCHIVE_NODE)
                .ports(3002)
                .resources(ResourceRequirements.of(2, 4, 100))
                .defaultSetting("KASIA_INDEXER_PORT", "3002")
                .defaultSetting("KASIA_NODE_MODE", "local")
                .field(SettingField.of("KASIA_INDEXER_PORT", SettingType.PORT, "Indexer API port"))
                .field(SettingField.choice("KASIA_NODE_MODE", NODE_MODES, "Node the indexer reads from"))
                .build();
    }

    private static Profile kIndexerBundle() {
        String owner = K_INDEXER_BUNDLE;
        return Profile.builder(owner, "K-Indexer")
                .description("Indexer backing K-Social, with TimescaleDB")
                .service(new ServiceRef("timescaledb-kindexer", Set.of(owner), 2, TIMESCALEDB, null,
                        Map.of("TIMESCALEDB_KINDEXER_PORT", 5432),
                        postgresEnv("KINDEXER"),
                        List.of("${KASPA_DATA_DIR}/timescaledb-kindexer:/var/lib/postgresql/data")))
                .service(new ServiceRef("k-indexer", Set.of(owner), 3, null,
                        BuildSpec.of("./services/k-indexer"),
                        Map.of("K_INDEXER_PORT", 3000),
                        indexerEnv("K_INDEXER_NODE_MODE", "KINDEXER"),
                        List.of()))
                .recommends(KASPA_NODE, KASPA_ARCHIVE_NODE)
                .ports(3006, 5433)
                .resources(ResourceRequirements.of(2, 4, 200))
                .defaultSetting("K_INDEXER_PORT", "3006")
                .defaultSetting("TIMESCALEDB_KINDEXER_PORT", "5433")
                .defaultSetting("K_INDEXER_NODE_MODE", "local")
                .defaultSetting("POSTGRES_USER_KINDEXER", "k_indexer")
                .defaultSetting("POSTGRES_DB_KINDEXER", "k_indexer")
                .field(SettingField.of("K_INDEXER_PORT", SettingType.PORT, "Indexer API port"))
                .field(SettingField.of("TIMESCALEDB_KINDEXER_PORT", SettingType.PORT, "Indexer database port"))
                .field(SettingField.choice("K_INDEXER_NODE_MODE", NODE_MODES, "Node the indexer reads from"))
                .field(SettingField.of("POSTGRES_USER_KINDEXER", SettingType.STRING, "Indexer database user"))
                .field(SettingField.of("POSTGRES_DB_KINDEXER", SettingType.STRING, "Indexer database name"))
                .field(new SettingField("POSTGRES_PASSWORD_KINDEXER", SettingType.SECRET, true, List.of(),
                        "Indexer database password"))
                .build();
    }

    private static Profile stratum() {
        return Profile.builder(KASPA_STRATUM, "Kaspa Stratum Bridge")
                .description("Stratum bridge for solo or pool mining")
                .service(new ServiceRef("kaspa-stratum", Set.of(KASPA_STRATUM), 4, null,
                        BuildSpec.of("./services/kaspa-stratum"),
                        Map.of("STRATUM_PORT", 5555),
                        orderedEnv("KASPA_NETWORK", "KASPA_NETWORK",
                                "MINING_ADDRESS", "MINING_ADDRESS",
                                "MIN_SHARE_DIFF", "MIN_SHARE_DIFF",
                                "VAR_DIFF", "VAR_DIFF",
                                "SHARES_PER_MIN", "SHARES_PER_MIN",
                                "POOL_MODE", "POOL_MODE"),
                        List.of()))
                .prerequisites(KASPA_NODE, KASPA_ARCHIVE_NODE)
                .ports(5555)
                .resources(ResourceRequirements.of(2, 2, 10))
                .requiredSettings("MINING_ADDRESS")
                .defaultSetting("STRATUM_PORT", "5555")
                .defaultSetting("MIN_SHARE_DIFF", "4")
                .defaultSetting("VAR_DIFF", "true")
                .defaultSetting("SHARES_PER_MIN", "20")
                .defaultSetting("POOL_MODE", "false")
                .field(SettingField.of("STRATUM_PORT", SettingType.PORT, "Stratum listen port"))
                .field(SettingField.required("MINING_ADDRESS", SettingType.KASPA_ADDRESS, "Address receiving rewards"))
                .field(SettingField.of("MIN_SHARE_DIFF", SettingType.NUMBER, "Minimum share difficulty"))
                .field(SettingField.of("VAR_DIFF", SettingType.BOOLEAN, "Enable variable difficulty"))
                .field(SettingField.of("SHARES_PER_MIN", SettingType.NUMBER, "Target shares per minute"))
                .field(SettingField.of("POOL_MODE", SettingType.BOOLEAN, "Run as a pool"))
                .build();
    }

    private static Map<String, String> postgresEnv(String suffix) {
        return orderedEnv("POSTGRES_USER", "POSTGRES_USER_" + suffix,
                "POSTGRES_PASSWORD", "POSTGRES_PASSWORD_" + suffix,
                "POSTGRES_DB", "POSTGRES_DB_" + suffix);
    }

    private static Map<String, String> indexerEnv(String nodeModeKey, String dbSuffix) {
        return orderedEnv("KASPA_NETWORK", "KASPA_NETWORK",
                "NODE_MODE", nodeModeKey,
                "REMOTE_KASPA_NODE_WRPC_URL", "REMOTE_KASPA_NODE_WRPC_URL",
                "POSTGRES_USER", "POSTGRES_USER_" + dbSuffix,
                "POSTGRES_PASSWORD", "POSTGRES_PASSWORD_" + dbSuffix,
                "POSTGRES_DB", "POSTGRES_DB_" + dbSuffix);
    }

    private static Map<String, String> orderedEnv(String... pairs) {
        var env = new LinkedHashMap<String, String>();
        for (int i = 0; i < pairs.length; i += 2) {
            env.put(pairs[i], pairs[i + 1]);
        }
        return env;
    }
}
