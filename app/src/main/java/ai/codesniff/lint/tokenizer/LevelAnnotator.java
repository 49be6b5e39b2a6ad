package ai.codesniff.lint.tokenizer;

import ai.codesniff.lint.token.StructuralWarning;
import ai.codesniff.lint.token.TokenStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Assigns nesting level and enclosing conditions from the resolved scope map.
 *
 * <p>A scope opens at its opener token and closes at its closer; the condition, its opener and its closer all
 * carry the level outside the scope. Braceless scopes have no opener token and do not change the level.
 */
public final class LevelAnnotator implements AnnotationStage {

    @Override
    public String name() {
        return "level-map";
    }

    @Override
    public TokenStream annotate(TokenStream stream) {
        List<int[]> open = new ArrayList<>();
        List<Integer> conditions = List.of();
        for (int i = 0; i < stream.size(); i++) {
            if (closeScopes(stream, open, i)) {
                conditions = snapshot(open);
            }

            stream.setLevel(i, open.size(), conditions);

            int condition = stream.scopeCondition(i);
            int closer = stream.scopeCloser(i);
            if (condition != TokenStream.NONE && stream.scopeOpener(i) == i && closer > i) {
                open.add(new int[] {condition, closer});
                conditions = snapshot(open);
            }
        }
        return stream;
    }

    private static boolean closeScopes(TokenStream stream, List<int[]> open, int index) {
        boolean changed = false;
        while (!open.isEmpty() && top(open)[1] < index) {
            int[] stale = open.remove(open.size() - 1);
            stream.addWarning(StructuralWarning.Kind.LEVEL_MISMATCH, stale[0],
                    "Scope of '" + stream.content(stale[0]) + "' was still open after its closer");
            changed = true;
        }
        int match = -1;
        for (int s = open.size() - 1; s >= 0; s--) {
            if (open.get(s)[1] == index) {
                match = s;
            }
        }
        if (match < 0) {
            return changed;
        }
        while (open.size() > match) {
            int[] entry = open.remove(open.size() - 1);
            if (entry[1] != index) {
                stream.addWarning(StructuralWarning.Kind.LEVEL_MISMATCH, entry[0],
                        "Scope of '" + stream.content(entry[0]) + "' on line " + stream.get(entry[0]).line()
                                + " is cut short by the closer on line " + stream.get(index).line());
            }
        }
        return true;
    }

    private static int[] top(List<int[]> open) {
        return open.get(open.size() - 1);
    }

    private static List<Integer> snapshot(List<int[]> open) {
        List<Integer> conditions = new ArrayList<>(open.size());
        for (int[] entry : open) {
            conditions.add(entry[0]);
        }
        return List.copyOf(conditions);
    }
}
