/**
 * @file Utils.java
 * @brief misc collection of static methods and functions
 * @author Doug Anson
 * @version 1.0
 * @see
 *
 * Copyright 2015. ARM Ltd. All rights reserved.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */
package org.fiware.ngsi.source.core;

import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.ArrayList;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;

/**
 * Static support utilities
 *
 * @author Doug Anson
 */
public class Utils {
    // ISO 8601 format used by NGSI v2 for expiration dates
    public static final String ISO8601_FORMAT = "yyyy-MM-dd'T'HH:mm:ss.SSS'Z'";

    // get the current date and time
    public static java.util.Date now() {
        return new java.util.Date();
    }

    // date some milliseconds from now
    public static java.util.Date dateFromNow(long offset_ms) {
        return new java.util.Date(System.currentTimeMillis() + offset_ms);
    }

    // convert a date to a string
    public static String dateToString(java.util.Date date) {
        return Utils.dateToString(date, "MM/dd/yyyy HH:mm:ss");
    }

    // convert a date to a string with a given format
    public static String dateToString(java.util.Date date, String format) {
        if (date != null) {
            DateFormat df = new SimpleDateFormat(format);
            return df.format(date);
        }
        else {
            return "[no date]";
        }
    }

    // ISO 8601 UTC form of a date (as required by NGSI "expires")
    public static String dateToISO8601(java.util.Date date) {
        if (date != null) {
            DateFormat df = new SimpleDateFormat(ISO8601_FORMAT);
            df.setTimeZone(TimeZone.getTimeZone("UTC"));
            return df.format(date);
        }
        return null;
    }

    // trim a possibly null string
    public static String trim(String val) {
        if (val == null) {
            return "";
        }
        return val.trim();
    }

    // split a string with a regex, dropping nothing (an empty string yields one empty element)
    public static List<String> split(String val, String regex) {
        ArrayList<String> list = new ArrayList<>();
        for (String item : Utils.trim(val).split(regex, -1)) {
            list.add(item);
        }
        return list;
    }

    // HTTP response code check
    public static boolean httpResponseCodeOK(int code) {
        int check = code - 200;
        if (check >= 0 && check < 100) {
            return true;
        }
        return false;
    }
}
