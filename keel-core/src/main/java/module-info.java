/**
 * Keel Core Module
 *
 * Configuration shared by the Keel mailbox modules.
 *
 * @since 0.1.0
 */
module com.keelsystems.core {
    exports com.keelsystems.config;
}
