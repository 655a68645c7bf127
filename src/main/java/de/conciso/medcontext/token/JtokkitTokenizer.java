package de.conciso.medcontext.token;

import com.knuddels.jtokkit.Encodings;
import com.knuddels.jtokkit.api.Encoding;
import com.knuddels.jtokkit.api.EncodingRegistry;
import com.knuddels.jtokkit.api.IntArrayList;

/**
 * {@link Tokenizer} auf Basis von JTokkit (BPE-Encodings der OpenAI-Modelle).
 */
public class JtokkitTokenizer implements Tokenizer {

    private static final EncodingRegistry REGISTRY = Encodings.newDefaultEncodingRegistry();

    private final Encoding encoding;

    public JtokkitTokenizer(String encodingName) {
        this.encoding = REGISTRY.getEncoding(encodingName)
                .orElseThrow(() -> new IllegalArgumentException("Unknown token encoding: " + encodingName));
    }

    @Override
    public int[] encode(String text) {
        return encoding.encode(text).toArray();
    }

    @Override
    public String decode(int[] tokens) {
        IntArrayList list = new IntArrayList(tokens.length);
        for (int token : tokens) {
            list.add(token);
        }
        return encoding.decode(list);
    }

    public String encodingName() {
        return encoding.getName();
    }
}
