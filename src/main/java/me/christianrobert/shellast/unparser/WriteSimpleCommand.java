package me.christianrobert.shellast.unparser;

import me.christianrobert.shellast.ast.command.SimpleCommand;
import me.christianrobert.shellast.ast.element.Word;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Static helper for writing simple commands.
 *
 * <p>Assignments normally precede the command name ({@code FOO=1 cmd}). For declaration
 * builtins they are arguments, so they follow the name and its option words
 * ({@code local -r x=1}).
 */
public class WriteSimpleCommand {

    static final Set<String> DECLARATION_BUILTINS = Set.of("local", "export", "declare", "readonly", "typeset");

    public static String v(SimpleCommand command, ShellCodeBuilder b) {
        List<String> parts = new ArrayList<>();
        List<Word> words = command.getWords();

        if (!words.isEmpty() && DECLARATION_BUILTINS.contains(words.get(0).getText())) {
            parts.add(words.get(0).getText());
            int i = 1;
            while (i < words.size() && words.get(i).getText().startsWith("-")) {
                parts.add(words.get(i).getText());
                i++;
            }
            parts.addAll(command.getAssignments());
            for (; i < words.size(); i++) {
                parts.add(words.get(i).getText());
            }
        } else {
            parts.addAll(command.getAssignments());
            for (Word word : words) {
                parts.add(word.getText());
            }
        }

        String text = String.join(" ", parts);
        String redirects = b.redirects(command.getRedirects());
        if (text.isEmpty() && !redirects.isEmpty()) {
            return redirects.substring(1);
        }
        return text + redirects;
    }
}
