package com.cankv.resp;

import com.cankv.error.RequestException;
import io.vertx.core.buffer.Buffer;

/**
 * Bağlantı başına tutulan mesaj birleştiricisidir. {@link RespDecoder} ile
 * çözülen her birimi biriken köke ekler ve kök tamamlandığında mesajı teslim
 * eder. Yarım kalan kök, ağdan gelen parçalar arasında korunur.
 */
public final class RespMessageReader
{
    private final RespDecoder decoder;
    private Value partial;

    public RespMessageReader(RespDecoder decoder)
    {
        this.decoder = decoder;
    }

    public void feed(Buffer chunk)
    {
        decoder.feed(chunk);
    }

    /**
     * @return tamamlanmış bir sonraki mesaj ya da daha fazla bayt gerekiyorsa {@code null}
     * @throws RequestException çerçeve bozuksa; yarım mesaj atılır
     */
    public Value nextMessage()
    {
        while (true) {
            Value unit;
            try {
                unit = decoder.decodeOne();
            } catch (RequestException e) {
                partial = null;
                throw e;
            }
            if (unit == null) {
                return null;
            }
            if (partial == null) {
                partial = unit;
            } else {
                partial.append(unit);
            }
            if (partial.isComplete()) {
                Value message = partial;
                partial = null;
                return message;
            }
        }
    }

    public boolean hasPartialMessage()
    {
        return partial != null;
    }
}
