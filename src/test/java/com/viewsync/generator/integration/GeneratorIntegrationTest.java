package com.viewsync.generator.integration;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Instant;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.viewsync.generator.cli.GenerateCommand;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Integration tests for the complete generation process, from outline file to view source.
 */
class GeneratorIntegrationTest {

    @TempDir
    Path tempDir;

    private Path outline;
    private Path outputDir;
    private Path mainMenuView;

    @BeforeEach
    void setUp() throws IOException {
        outline = tempDir.resolve("menus.outline");
        outputDir = tempDir.resolve("src/main/java");
        mainMenuView = outputDir.resolve("game/ui/MainMenu.java");

        Files.writeString(outline, """
                # Main menu and settings screens
                MainMenu : ui.LayoutBox
                  Panel : ui.LayoutBox @bind(name=panel, target=container)
                    OkButton : ui.LayoutBox, ui.Button
                    Volume : ui.Slider
                  Title : ui.Text @bind(name=heading)
                  Decor @bind(ignore=true)
                    Sparkle : ui.Button
                Settings
                  Sound : ui.Toggle
                """);
    }

    private int run(String... extraArgs) {
        String[] args = new String[extraArgs.length + 5];
        args[0] = "-o";
        args[1] = outputDir.toString();
        args[2] = "-n";
        args[3] = "game.ui";
        System.arraycopy(extraArgs, 0, args, 4, extraArgs.length);
        args[args.length - 1] = outline.toString();
        CommandLine commandLine = new CommandLine(new GenerateCommand());
        commandLine.setCaseInsensitiveEnumValuesAllowed(true);
        return commandLine.execute(args);
    }

    @Test
    void testGenerateViewsFromOutline() throws IOException {
        assertThat(run()).isZero();

        assertThat(Files.exists(mainMenuView)).isTrue();
        assertThat(Files.exists(outputDir.resolve("game/ui/Settings.java"))).isTrue();

        String source = Files.readString(mainMenuView);
        assertThat(source).contains("package game.ui;");
        assertThat(source).contains("public class MainMenu extends ui.ViewBehaviour {");
        assertThat(source).contains("    private ui.LayoutBox _boxPanel;");
        assertThat(source).contains("    private ui.Button _btnOkButton;");
        assertThat(source).contains("    private ui.Slider _sldVolume;");
        assertThat(source).contains("    private ui.Text _txtHeading;");
        assertThat(source).doesNotContain("Sparkle");
        assertThat(source).contains("node = findNode(\"Panel/OkButton\");");
        assertThat(source).contains("this._boxPanel = node.getContainer();");

        assertThat(Files.readString(outputDir.resolve("game/ui/Settings.java")))
                .contains("    private ui.Toggle _togSound;");
    }

    @Test
    void testRerunWithoutChangesLeavesFilesAlone() throws IOException {
        assertThat(run()).isZero();
        FileTime old = FileTime.from(Instant.parse("2020-01-01T00:00:00Z"));
        Files.setLastModifiedTime(mainMenuView, old);
        String before = Files.readString(mainMenuView);

        assertThat(run()).isZero();

        assertThat(Files.getLastModifiedTime(mainMenuView)).isEqualTo(old);
        assertThat(Files.readString(mainMenuView)).isEqualTo(before);
    }

    @Test
    void testHandWrittenCodeSurvivesOutlineChanges() throws IOException {
        assertThat(run()).isZero();
        String generated = Files.readString(mainMenuView);
        String userMethod = "    public void onOkClicked() {\n        warn(\"clicked { ok }\");\n    }\n";
        Files.writeString(mainMenuView, generated
                .replace("package game.ui;\n", "package game.ui;\n\nimport java.util.List;\n")
                .replace("    // <user-code>\n", "    // <user-code>\n" + userMethod));

        Files.writeString(outline, """
                MainMenu : ui.LayoutBox
                  Panel : ui.LayoutBox @bind(name=panel, target=container)
                    OkButton : ui.LayoutBox, ui.Button
                    CancelButton : ui.Button
                  Title : ui.Text @bind(name=heading)
                """);

        assertThat(run("--properties")).isZero();

        String source = Files.readString(mainMenuView);
        assertThat(source).contains("import java.util.List;");
        assertThat(source).contains(userMethod);
        assertThat(source).contains("    private ui.Button _btnCancelButton;");
        assertThat(source).doesNotContain("_sldVolume");
        assertThat(source).contains("public ui.Button getCancelButton() { return _btnCancelButton; }");
        assertThat(source.indexOf(userMethod)).isGreaterThan(source.indexOf("// </auto-assign>"));
    }

    @Test
    void testRootFilterAndDeclarativeMode() throws IOException {
        assertThat(run("-r", "Settings", "--binding-mode", "declarative_reference")).isZero();

        assertThat(Files.exists(mainMenuView)).isFalse();
        String source = Files.readString(outputDir.resolve("game/ui/Settings.java"));
        assertThat(source).contains("    @Persisted private ui.Toggle _togSound;");
        assertThat(source).doesNotContain("onBind");
    }

    @Test
    void testDryRunAndListFieldsWriteNothing() {
        assertThat(run("--dry-run")).isZero();
        assertThat(run("--list-fields")).isZero();

        assertThat(Files.exists(outputDir)).isFalse();
    }

    @Test
    void testOutlineErrorsFailTheRun() throws IOException {
        Files.writeString(outline, "MainMenu\n\tOkButton : ui.Button\n");

        assertThat(run()).isEqualTo(1);
        assertThat(Files.exists(mainMenuView)).isFalse();
    }

    @Test
    void testInvalidRootNameFailsTheRun() throws IOException {
        Files.writeString(outline, "mainMenu\n  OkButton : ui.Button\nSettings\n");

        assertThat(run()).isEqualTo(1);
        assertThat(Files.exists(outputDir.resolve("game/ui/Settings.java"))).isTrue();
        assertThat(run("--allow-lowercase-class-names")).isZero();
        assertThat(Files.exists(outputDir.resolve("game/ui/mainMenu.java"))).isTrue();
    }

    @Test
    void testInvalidOptionsFailTheRun() {
        assertThat(run("--init-method", "not valid")).isEqualTo(1);
    }
}
