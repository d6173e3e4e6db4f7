package ai.usinglint.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

public class GeneratedCodeDetectorTest {

    @ParameterizedTest
    @ValueSource(
            strings = {
                "Form1.Designer.cs",
                "src/Views/Main.g.cs",
                "Main.g.i.cs",
                "Api.generated.cs",
                "obj\\Debug\\App.AssemblyAttributes.cs",
                "TemporaryGeneratedFile_036C0B5B.cs"
            })
    void recognizesGeneratedFileNames(String fileName) {
        assertTrue(GeneratedCodeDetector.hasGeneratedName(fileName));
    }

    @ParameterizedTest
    @ValueSource(strings = {"Program.cs", "Designer.cs", "Signal.cs", "generated/Program.cs"})
    void ordinaryFileNamesAreNotGenerated(String fileName) {
        assertFalse(GeneratedCodeDetector.hasGeneratedName(fileName));
    }

    @Test
    void autoGeneratedLineCommentHeader() {
        var source =
                """
                //------------------------------------------------------------------------------
                // <auto-generated>
                //     This code was generated by a tool.
                // </auto-generated>
                //------------------------------------------------------------------------------
                using Col = System.Collections;
                using System;
                """;
        assertTrue(GeneratedCodeDetector.hasGeneratedHeader(source));
        assertTrue(GeneratedCodeDetector.isGenerated("Plain.cs", source));
    }

    @Test
    void autoGeneratedBlockCommentHeader() {
        var source =
                """
                /*
                 * <autogenerated/>
                 */
                using System;
                """;
        assertTrue(GeneratedCodeDetector.hasGeneratedHeader(source));
    }

    @Test
    void markerAfterFirstCodeLineIsIgnored() {
        var source =
                """
                // Copyright header
                using System;
                // <auto-generated>
                """;
        assertFalse(GeneratedCodeDetector.hasGeneratedHeader(source));
    }

    @Test
    void byteOrderMarkBeforeHeaderIsTolerated() {
        assertTrue(GeneratedCodeDetector.hasGeneratedHeader("\uFEFF// <auto-generated />\nusing System;\n"));
    }

    @Test
    void handWrittenSourceIsNotGenerated() {
        assertFalse(GeneratedCodeDetector.isGenerated("Program.cs", "using System;\n\nclass Program {}\n"));
    }
}
