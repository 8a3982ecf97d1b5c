package com.ryuqq.toolbox.testkit.contract;

import com.ryuqq.toolbox.adapter.inmemory.catalog.CategoryTreeBuilder;
import com.ryuqq.toolbox.core.command.LocalFileCommand;
import com.ryuqq.toolbox.core.model.CatalogNode;
import com.ryuqq.toolbox.core.model.CatalogSnapshot;
import com.ryuqq.toolbox.core.model.NodeId;

import java.nio.file.Path;

/**
 * Reference catalog used by the contract tests.
 *
 * <pre>
 * System Tools
 *   ├── System (directory)
 *   │     ├── Kernel Version   raw "uname -r"
 *   │     └── Disk Usage       raw "df -h"
 *   └── Update               raw "echo ok"          multiSelect
 *
 * Applications
 *   ├── Install Alpha        raw "echo alpha"       multiSelect
 *   ├── Install Beta         raw "echo beta"        multiSelect
 *   ├── Broken Installer     raw "echo boom 1&gt;&amp;2; exit 3"  multiSelect
 *   ├── Missing Tool         script "no-such-executable-xyz"
 *   └── Editors (directory, multiSelect)
 *         └── Vim            raw "echo vim"
 * </pre>
 *
 * @author Toolbox Team
 * @since 1.0.0
 */
public final class CatalogFixtures {

    public static final String SYSTEM_TOOLS = "System Tools";
    public static final String APPLICATIONS = "Applications";

    public static final NodeId SYSTEM = NodeId.of("system");
    public static final NodeId KERNEL_VERSION = NodeId.of("kernel-version");
    public static final NodeId DISK_USAGE = NodeId.of("disk-usage");
    public static final NodeId UPDATE = NodeId.of("update");

    public static final NodeId INSTALL_ALPHA = NodeId.of("install-alpha");
    public static final NodeId INSTALL_BETA = NodeId.of("install-beta");
    public static final NodeId BROKEN_INSTALLER = NodeId.of("broken-installer");
    public static final NodeId MISSING_TOOL = NodeId.of("missing-tool");
    public static final NodeId EDITORS = NodeId.of("editors");
    public static final NodeId VIM = NodeId.of("vim");

    // Utility class - prevent instantiation
    private CatalogFixtures() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * Builds a fresh snapshot instance (identity differs on every call).
     */
    public static CatalogSnapshot snapshot() {
        return CatalogSnapshot.of(
            CategoryTreeBuilder.category(SYSTEM_TOOLS)
                .directory(SYSTEM.getValue(), "System", "System utilities", dir -> dir
                    .raw(KERNEL_VERSION.getValue(), "Kernel Version", "Show the running kernel", "uname -r")
                    .raw(DISK_USAGE.getValue(), "Disk Usage", "Show mounted file systems", "df -h"))
                .node(CatalogNode.raw(UPDATE.getValue(), "Update", "Refresh package lists", "echo ok")
                    .withMultiSelect(true))
                .build(),
            CategoryTreeBuilder.category(APPLICATIONS)
                .node(CatalogNode.raw(INSTALL_ALPHA.getValue(), "Install Alpha", "First sample package", "echo alpha")
                    .withMultiSelect(true).withTags("packages"))
                .node(CatalogNode.raw(INSTALL_BETA.getValue(), "Install Beta", "Second sample package", "echo beta")
                    .withMultiSelect(true).withTags("packages"))
                .node(CatalogNode.raw(BROKEN_INSTALLER.getValue(), "Broken Installer", "Always fails",
                        "echo boom 1>&2; exit 3")
                    .withMultiSelect(true))
                .node(CatalogNode.script(MISSING_TOOL.getValue(), "Missing Tool", "Executable is not installed",
                    LocalFileCommand.of("no-such-executable-xyz", Path.of("/tmp/missing-tool.sh"), "/tmp/missing-tool.sh")))
                .directory(EDITORS.getValue(), "Editors", "Text editors", true, dir -> dir
                    .raw(VIM.getValue(), "Vim", "Install vim", "echo vim"))
                .build()
        );
    }
}
