package de.caluga.bson.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.function.Consumer;

/**
 * base of all settings classes. Every non static field is a setting, named
 * like the field; settings can be exported to and read from
 * {@link Properties} with an optional prefix.
 **/
public abstract class Settings {
    private static final Logger log = LoggerFactory.getLogger(Settings.class);

    public Properties asProperties() {
        return asProperties(null);
    }

    /**
     * only settings that differ from the defaults are exported
     */
    public Properties asProperties(String prefix) {
        Properties p = new Properties();

        try {
            if (prefix == null || prefix.isEmpty()) prefix = ""; else prefix = prefix + ".";

            var defaults = this.getClass().getConstructor().newInstance();

            for (Field f : getAllFields(this.getClass())) {
                f.setAccessible(true);

                if (f.get(this) != null && !f.get(this).equals(f.get(defaults))) {
                    p.put(prefix + f.getName(), f.get(this).toString());
                }
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to export settings of " + this.getClass().getName(), e);
        }

        return p;
    }

    /**
     * sets all fields found in the properties, unknown keys are ignored.
     * Values that cannot be parsed are logged and skipped.
     */
    public void applyProperties(String prefix, Properties prop) {
        if (prefix == null || prefix.isEmpty()) prefix = ""; else prefix = prefix + ".";

        for (Field f : getAllFields(this.getClass())) {
            String fName = prefix + f.getName();
            String setting = prop.getProperty(fName);

            if (setting == null) {
                continue;
            }

            f.setAccessible(true);
            setting = setting.trim();

            try {
                if (f.getType().equals(int.class) || f.getType().equals(Integer.class)) {
                    f.set(this, Integer.parseInt(setting));
                } else if (f.getType().equals(long.class) || f.getType().equals(Long.class)) {
                    f.set(this, Long.parseLong(setting));
                } else if (f.getType().equals(boolean.class) || f.getType().equals(Boolean.class)) {
                    f.set(this, setting.equalsIgnoreCase("true"));
                } else if (f.getType().isEnum()) {
                    @SuppressWarnings({"unchecked", "rawtypes"})
                    Enum value = Enum.valueOf((Class<? extends Enum>) f.getType(), setting);
                    f.set(this, value);
                } else if (f.getType().equals(String.class)) {
                    f.set(this, setting);
                } else {
                    log.warn("setting {} of type {} cannot be read from properties", fName, f.getType().getName());
                }
            } catch (IllegalArgumentException e) {
                log.warn("could not parse setting {}={}: {}", fName, setting, e.getMessage());
            } catch (IllegalAccessException e) {
                throw new RuntimeException(e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    public <T extends Settings> T copy() {
        try {
            T ret = (T) this.getClass().getConstructor().newInstance();

            for (Field f : getAllFields(this.getClass())) {
                f.setAccessible(true);
                f.set(ret, f.get(this));
            }

            return ret;
        } catch (Exception e) {
            throw new RuntimeException("Failed to copy settings for " + this.getClass().getName(), e);
        }
    }

    @SuppressWarnings("unchecked")
    public <T extends Settings> T copyWith(Consumer<T> mutator) {
        T c = (T) copy();
        if (mutator != null) mutator.accept(c);
        return c;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) return true;
        if (other == null) return false;
        if (getClass() != other.getClass()) return false;

        for (Field f : getAllFields(this.getClass())) {
            f.setAccessible(true);

            try {
                if (!Objects.equals(f.get(this), f.get(other))) return false;
            } catch (IllegalAccessException e) {
                throw new RuntimeException(e);
            }
        }

        return true;
    }

    @Override
    public int hashCode() {
        int result = 1;

        for (Field f : getAllFields(this.getClass())) {
            f.setAccessible(true);

            try {
                result = 31 * result + Objects.hashCode(f.get(this));
            } catch (IllegalAccessException e) {
                throw new RuntimeException(e);
            }
        }

        return result;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + asProperties();
    }

    private static List<Field> getAllFields(Class<?> cls) {
        List<Class<?>> hierarchy = new ArrayList<>();
        Class<?> sc = cls;

        while (sc != null && !sc.equals(Settings.class) && !sc.equals(Object.class)) {
            hierarchy.add(sc);
            sc = sc.getSuperclass();
        }

        //super classes first, so subclasses can shadow fields
        Collections.reverse(hierarchy);
        List<Field> ret = new ArrayList<>();

        for (Class<?> c : hierarchy) {
            for (Field f : c.getDeclaredFields()) {
                if (Modifier.isStatic(f.getModifiers()) || f.isSynthetic()) {
                    continue;
                }

                ret.add(f);
            }
        }

        return ret;
    }
}
