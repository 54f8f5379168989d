package gr.imsi.athenarc.illustrator.util;

import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import gr.imsi.athenarc.illustrator.domain.Point;

/**
 * Converts {@code x,y} command line values.
 */
public class PointConverter implements IStringConverter<Point> {
    @Override
    public Point convert(String value) {
        String[] parts = value.split(",");
        if (parts.length != 2) {
            throw new ParameterException("Expected x,y but got " + value);
        }
        try {
            return new Point(Double.parseDouble(parts[0].trim()), Double.parseDouble(parts[1].trim()));
        } catch (NumberFormatException e) {
            throw new ParameterException("Expected x,y but got " + value, e);
        }
    }
}
